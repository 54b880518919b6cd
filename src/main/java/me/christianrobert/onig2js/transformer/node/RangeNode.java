package me.christianrobert.onig2js.transformer.node;

/**
 * Set member range such as {@code a-z}. Endpoints are raw literal texts,
 * escapes included.
 */
public class RangeNode extends Node {

    private final String from;
    private final String to;

    public RangeNode(String from, String to) {
        if (from == null || from.isEmpty() || to == null || to.isEmpty()) {
            throw new IllegalArgumentException("Range endpoints cannot be null or empty");
        }
        this.from = from;
        this.to = to;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RANGE;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    @Override
    public String getText() {
        return from + "-" + to;
    }
}
