package me.christianrobert.onig2js.transformer.node;

public enum QuantifierMode {
    GREEDY(""),
    RELUCTANT("?"),
    POSSESSIVE("+");

    private final String suffix;

    QuantifierMode(String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }
}
