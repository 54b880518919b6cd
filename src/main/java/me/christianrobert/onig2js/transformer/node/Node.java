package me.christianrobert.onig2js.transformer.node;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Base class for all nodes of a parsed Onigmo pattern tree.
 *
 * <p>Nodes are built once through {@link Nodes} and are read-only afterwards.
 * Every node may carry a case-insensitivity annotation: {@code null} means the
 * subtree inherits the enclosing scope, {@code TRUE}/{@code FALSE} means an
 * inline option switched the scope for this subtree.</p>
 */
public abstract class Node {

    private Boolean caseInsensitive;

    public abstract NodeKind getKind();

    /**
     * Renders the node back to (approximate) Onigmo source syntax.
     * Used in warning messages and tree dumps.
     *
     * <p>Leaf nodes override this. Composite nodes describe themselves through
     * {@link #textChildren()}, {@link #textPrefix()}, {@link #textSeparator()} and
     * {@link #textSuffix()}, and are rendered without recursion, so arbitrarily
     * deep trees can be rendered.</p>
     */
    public String getText() {
        StringBuilder sb = new StringBuilder();
        Deque<TextFrame> stack = new ArrayDeque<>();
        sb.append(textPrefix());
        stack.push(new TextFrame(this, textChildren()));
        while (!stack.isEmpty()) {
            TextFrame frame = stack.peek();
            if (frame.next >= frame.children.size()) {
                sb.append(frame.node.textSuffix());
                stack.pop();
                continue;
            }
            if (frame.next > 0) {
                sb.append(frame.node.textSeparator());
            }
            Node child = frame.children.get(frame.next++);
            List<Node> grandChildren = child.textChildren();
            if (grandChildren == null) {
                sb.append(child.getText());
            } else {
                sb.append(child.textPrefix());
                stack.push(new TextFrame(child, grandChildren));
            }
        }
        return sb.toString();
    }

    /**
     * Children rendered between prefix and suffix, or {@code null} for leaf
     * nodes, which render through {@link #getText()} alone.
     */
    protected List<Node> textChildren() {
        return null;
    }

    protected String textPrefix() {
        return "";
    }

    protected String textSeparator() {
        return "";
    }

    protected String textSuffix() {
        return "";
    }

    public List<Node> getChildren() {
        return Collections.emptyList();
    }

    public Boolean getCaseInsensitive() {
        return caseInsensitive;
    }

    void annotateCaseInsensitive(Boolean caseInsensitive) {
        this.caseInsensitive = caseInsensitive;
    }

    @Override
    public String toString() {
        return getKind() + "{" + getText() + "}";
    }

    private static final class TextFrame {

        private final Node node;
        private final List<Node> children;
        private int next;

        private TextFrame(Node node, List<Node> children) {
            this.node = node;
            this.children = children != null ? children : Collections.emptyList();
        }
    }
}
