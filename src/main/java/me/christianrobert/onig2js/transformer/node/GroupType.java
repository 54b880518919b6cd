package me.christianrobert.onig2js.transformer.node;

/**
 * Parenthesized constructs recognized by the Onigmo parser.
 */
public enum GroupType {
    /** {@code (x)} */
    CAPTURE("(", ")"),
    /** {@code (?:x)} */
    PASSIVE("(?:", ")"),
    /** {@code (?<name>x)} or {@code (?'name'x)} */
    NAMED("(?<", ")"),
    /** {@code (?>x)} */
    ATOMIC("(?>", ")"),
    /** {@code (?~x)} */
    ABSENCE("(?~", ")"),
    /** {@code (?#...)} */
    COMMENT("(?#", ")"),
    /** {@code (?i-m:x)}, options applied to the enclosed content */
    OPTIONS("(?", ")"),
    /** {@code (?i-m)}, options applied to the rest of the enclosing group */
    OPTIONS_SWITCH("(?", ")"),
    /** {@code (?=x)} */
    LOOKAHEAD("(?=", ")"),
    /** {@code (?!x)} */
    NEGATIVE_LOOKAHEAD("(?!", ")"),
    /** {@code (?<=x)} */
    LOOKBEHIND("(?<=", ")"),
    /** {@code (?<!x)} */
    NEGATIVE_LOOKBEHIND("(?<!", ")"),
    /** Anything else, e.g. conditionals or unsupported group heads. */
    UNKNOWN("(?", ")");

    private final String head;
    private final String tail;

    GroupType(String head, String tail) {
        this.head = head;
        this.tail = tail;
    }

    public String getHead() {
        return head;
    }

    public String getTail() {
        return tail;
    }

    public boolean isCapturing() {
        return this == CAPTURE || this == NAMED;
    }
}
