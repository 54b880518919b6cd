package me.christianrobert.onig2js.transformer.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class AlternationNode extends Node {

    private final List<Node> branches;

    public AlternationNode(List<Node> branches) {
        this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ALTERNATION;
    }

    public List<Node> getBranches() {
        return branches;
    }

    @Override
    public List<Node> getChildren() {
        return branches;
    }

    @Override
    protected List<Node> textChildren() {
        return branches;
    }

    @Override
    protected String textSeparator() {
        return "|";
    }
}
