package me.christianrobert.onig2js.transformer.node;

/**
 * Backreference by source group number ({@code \1}) or by name ({@code \k<name>}).
 * Exactly one of number and name is set.
 */
public class BackreferenceNode extends Node {

    private final Integer number;
    private final String name;

    private BackreferenceNode(Integer number, String name) {
        this.number = number;
        this.name = name;
    }

    public static BackreferenceNode byNumber(int number) {
        if (number < 1) {
            throw new IllegalArgumentException("Backreference number must be positive: " + number);
        }
        return new BackreferenceNode(number, null);
    }

    public static BackreferenceNode byName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Backreference name cannot be null or empty");
        }
        return new BackreferenceNode(null, name);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BACKREFERENCE;
    }

    public Integer getNumber() {
        return number;
    }

    public String getName() {
        return name;
    }

    public boolean isNamed() {
        return name != null;
    }

    @Override
    public String getText() {
        return isNamed() ? "\\k<" + name + ">" : "\\" + number;
    }
}
