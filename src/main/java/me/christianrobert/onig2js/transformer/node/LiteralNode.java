package me.christianrobert.onig2js.transformer.node;

/**
 * Run of literal text as written in the source, escapes included.
 */
public class LiteralNode extends Node {

    private final String text;

    public LiteralNode(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Literal text cannot be null or empty");
        }
        this.text = text;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LITERAL;
    }

    @Override
    public String getText() {
        return text;
    }
}
