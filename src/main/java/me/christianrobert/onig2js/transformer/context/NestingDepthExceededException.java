package me.christianrobert.onig2js.transformer.context;

/**
 * Thrown when the tree is nested deeper than the configured bound.
 */
public class NestingDepthExceededException extends ConversionException {

    private final int maxDepth;

    public NestingDepthExceededException(int maxDepth, String source) {
        super("Pattern tree exceeds maximum nesting depth of " + maxDepth, source, null);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
