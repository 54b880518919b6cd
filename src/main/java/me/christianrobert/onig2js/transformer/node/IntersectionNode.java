package me.christianrobert.onig2js.transformer.node;

/**
 * The {@code &&} marker between two operands of a set.
 */
public class IntersectionNode extends Node {

    @Override
    public NodeKind getKind() {
        return NodeKind.INTERSECTION;
    }

    @Override
    public String getText() {
        return "&&";
    }
}
