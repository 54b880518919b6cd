package me.christianrobert.onig2js.transformer.context;

/**
 * Fatal conversion failure: no usable pattern can be produced.
 * Captures detailed context about the failure.
 */
public class ConversionException extends RuntimeException {

    private final String source;
    private final String context;

    public ConversionException(String message) {
        super(message);
        this.source = null;
        this.context = null;
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
        this.source = null;
        this.context = null;
    }

    public ConversionException(String message, String source, String context) {
        super(message);
        this.source = source;
        this.context = context;
    }

    /**
     * Source text of the offending pattern or subtree, if known.
     */
    public String getSource() {
        return source;
    }

    public String getContext() {
        return context;
    }

    /**
     * Gets a detailed error message including source text and context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (source != null) {
            sb.append("\nSource: ").append(source);
        }
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
