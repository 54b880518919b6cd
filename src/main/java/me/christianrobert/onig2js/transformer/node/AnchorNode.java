package me.christianrobert.onig2js.transformer.node;

public class AnchorNode extends Node {

    private final AnchorKind anchorKind;

    public AnchorNode(AnchorKind anchorKind) {
        if (anchorKind == null) {
            throw new IllegalArgumentException("Anchor kind cannot be null");
        }
        this.anchorKind = anchorKind;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ANCHOR;
    }

    public AnchorKind getAnchorKind() {
        return anchorKind;
    }

    @Override
    public String getText() {
        return anchorKind.getText();
    }
}
