package me.christianrobert.onig2js.transformer.node;

/**
 * Placeholder for source syntax the parser could not classify.
 */
public class UnknownNode extends Node {

    private final String text;

    public UnknownNode(String text) {
        this.text = text != null ? text : "";
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNKNOWN;
    }

    @Override
    public String getText() {
        return text;
    }
}
