package me.christianrobert.onig2js.transformer.node;

/**
 * Named property or POSIX bracket class.
 *
 * <ul>
 *   <li>{@code \p{name}}: upperSign=false, caret=false</li>
 *   <li>{@code \P{name}}: upperSign=true</li>
 *   <li>{@code \p{^name}}: caret=true</li>
 *   <li>{@code [:name:]} / {@code [:^name:]}: posix=true, caret for the negated form</li>
 * </ul>
 */
public class PropertyNode extends Node {

    private final String name;
    private final boolean upperSign;
    private final boolean caret;
    private final boolean posix;

    public PropertyNode(String name, boolean upperSign, boolean caret, boolean posix) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Property name cannot be null or empty");
        }
        if (posix && upperSign) {
            throw new IllegalArgumentException("POSIX classes have no \\P form");
        }
        this.name = name;
        this.upperSign = upperSign;
        this.caret = caret;
        this.posix = posix;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PROPERTY;
    }

    public String getName() {
        return name;
    }

    public boolean isUpperSign() {
        return upperSign;
    }

    public boolean hasCaret() {
        return caret;
    }

    public boolean isPosix() {
        return posix;
    }

    /**
     * Negation expressed by the property itself, ignoring any enclosing set.
     */
    public boolean isNegated() {
        return upperSign ^ caret;
    }

    @Override
    public String getText() {
        if (posix) {
            return "[:" + (caret ? "^" : "") + name + ":]";
        }
        return (upperSign ? "\\P{" : "\\p{") + (caret ? "^" : "") + name + "}";
    }
}
