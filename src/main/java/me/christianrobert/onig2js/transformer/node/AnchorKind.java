package me.christianrobert.onig2js.transformer.node;

public enum AnchorKind {
    LINE_START("^"),
    LINE_END("$"),
    STRING_START("\\A"),
    STRING_END("\\z"),
    STRING_END_BEFORE_NEWLINE("\\Z"),
    WORD_BOUNDARY("\\b"),
    NONWORD_BOUNDARY("\\B"),
    MATCH_START("\\G");

    private final String text;

    AnchorKind(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }
}
