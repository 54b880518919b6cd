package me.christianrobert.onig2js.transformer.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of a parsed pattern, carrying the pattern-level options.
 */
public class RootNode extends Node {

    private final List<Node> children;
    private final boolean caseInsensitive;
    private final boolean dotAll;
    private final String source;

    public RootNode(List<Node> children, boolean caseInsensitive, boolean dotAll, String source) {
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        this.caseInsensitive = caseInsensitive;
        this.dotAll = dotAll;
        this.source = source;
        annotateCaseInsensitive(caseInsensitive);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ROOT;
    }

    @Override
    public List<Node> getChildren() {
        return children;
    }

    /**
     * Pattern-level {@code i} option.
     */
    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    /**
     * Pattern-level {@code m} option (Onigmo: dot matches newline).
     */
    public boolean isDotAll() {
        return dotAll;
    }

    /**
     * Original pattern source, if the parser supplied it. May be null.
     */
    public String getSource() {
        return source;
    }

    @Override
    protected List<Node> textChildren() {
        return source != null ? Collections.emptyList() : children;
    }

    @Override
    protected String textPrefix() {
        return source != null ? source : "";
    }
}
