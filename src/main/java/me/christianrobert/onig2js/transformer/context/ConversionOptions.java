package me.christianrobert.onig2js.transformer.context;

/**
 * Per-call conversion options. Instances are immutable; use the {@code with}
 * methods to derive variants.
 */
public class ConversionOptions {

    public static final boolean DEFAULT_ADD_GLOBAL_FLAG = true;
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;
    public static final boolean DEFAULT_INCLUDE_NODE_TREE = false;

    private final boolean addGlobalFlag;
    private final int maxNestingDepth;
    private final boolean includeNodeTree;

    public ConversionOptions(boolean addGlobalFlag, int maxNestingDepth, boolean includeNodeTree) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("Max nesting depth must be positive: " + maxNestingDepth);
        }
        this.addGlobalFlag = addGlobalFlag;
        this.maxNestingDepth = maxNestingDepth;
        this.includeNodeTree = includeNodeTree;
    }

    public static ConversionOptions defaults() {
        return new ConversionOptions(DEFAULT_ADD_GLOBAL_FLAG, DEFAULT_MAX_NESTING_DEPTH, DEFAULT_INCLUDE_NODE_TREE);
    }

    public boolean isAddGlobalFlag() {
        return addGlobalFlag;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public boolean isIncludeNodeTree() {
        return includeNodeTree;
    }

    public ConversionOptions withAddGlobalFlag(boolean addGlobalFlag) {
        return new ConversionOptions(addGlobalFlag, maxNestingDepth, includeNodeTree);
    }

    public ConversionOptions withMaxNestingDepth(int maxNestingDepth) {
        return new ConversionOptions(addGlobalFlag, maxNestingDepth, includeNodeTree);
    }

    public ConversionOptions withIncludeNodeTree(boolean includeNodeTree) {
        return new ConversionOptions(addGlobalFlag, maxNestingDepth, includeNodeTree);
    }

    @Override
    public String toString() {
        return "ConversionOptions{addGlobalFlag=" + addGlobalFlag +
               ", maxNestingDepth=" + maxNestingDepth +
               ", includeNodeTree=" + includeNodeTree + "}";
    }
}
