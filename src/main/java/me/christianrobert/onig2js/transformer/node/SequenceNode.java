package me.christianrobert.onig2js.transformer.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class SequenceNode extends Node {

    private final List<Node> children;

    public SequenceNode(List<Node> children) {
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SEQUENCE;
    }

    @Override
    public List<Node> getChildren() {
        return children;
    }

    @Override
    protected List<Node> textChildren() {
        return children;
    }
}
