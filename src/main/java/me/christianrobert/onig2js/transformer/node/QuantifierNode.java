package me.christianrobert.onig2js.transformer.node;

import java.util.Collections;
import java.util.List;

/**
 * Quantified child. A null {@code max} means unbounded repetition.
 */
public class QuantifierNode extends Node {

    private final Node child;
    private final int min;
    private final Integer max;
    private final QuantifierMode mode;

    public QuantifierNode(Node child, int min, Integer max, QuantifierMode mode) {
        if (child == null) {
            throw new IllegalArgumentException("Quantified child cannot be null");
        }
        if (min < 0 || (max != null && max < min)) {
            throw new IllegalArgumentException("Invalid quantifier bounds {" + min + "," + max + "}");
        }
        this.child = child;
        this.min = min;
        this.max = max;
        this.mode = mode != null ? mode : QuantifierMode.GREEDY;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.QUANTIFIER;
    }

    public Node getChild() {
        return child;
    }

    @Override
    public List<Node> getChildren() {
        return Collections.singletonList(child);
    }

    public int getMin() {
        return min;
    }

    public Integer getMax() {
        return max;
    }

    public boolean isUnbounded() {
        return max == null;
    }

    public QuantifierMode getMode() {
        return mode;
    }

    /**
     * Quantifier syntax without the mode suffix: {@code * + ? {n} {n,} {n,m}}.
     */
    public String getQuantifierText() {
        if (max == null) {
            if (min == 0) {
                return "*";
            }
            if (min == 1) {
                return "+";
            }
            return "{" + min + ",}";
        }
        if (min == 0 && max == 1) {
            return "?";
        }
        if (min == max) {
            return "{" + min + "}";
        }
        return "{" + min + "," + max + "}";
    }

    @Override
    protected List<Node> textChildren() {
        return getChildren();
    }

    @Override
    protected String textSuffix() {
        return getQuantifierText() + mode.getSuffix();
    }
}
