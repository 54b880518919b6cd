package me.christianrobert.onig2js.transformer.node;

public enum CharacterType {
    ANY("."),
    DIGIT("\\d"),
    NONDIGIT("\\D"),
    WORD("\\w"),
    NONWORD("\\W"),
    SPACE("\\s"),
    NONSPACE("\\S"),
    HEX("\\h"),
    NONHEX("\\H"),
    LINEBREAK("\\R"),
    EXTENDED_GRAPHEME("\\X");

    private final String text;

    CharacterType(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }
}
