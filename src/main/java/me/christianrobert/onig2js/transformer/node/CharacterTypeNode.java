package me.christianrobert.onig2js.transformer.node;

public class CharacterTypeNode extends Node {

    private final CharacterType type;

    public CharacterTypeNode(CharacterType type) {
        if (type == null) {
            throw new IllegalArgumentException("Character type cannot be null");
        }
        this.type = type;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CHARACTER_TYPE;
    }

    public CharacterType getType() {
        return type;
    }

    @Override
    public String getText() {
        return type.getText();
    }
}
