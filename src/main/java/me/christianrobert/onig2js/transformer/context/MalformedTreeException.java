package me.christianrobert.onig2js.transformer.context;

/**
 * Thrown when the input tree (or the context it is converted with) violates
 * the structural contract, e.g. a range outside a set or a reused context.
 */
public class MalformedTreeException extends ConversionException {

    public MalformedTreeException(String message) {
        super(message);
    }

    public MalformedTreeException(String message, String source) {
        super(message, source, null);
    }
}
