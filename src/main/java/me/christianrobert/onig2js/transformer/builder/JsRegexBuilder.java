package me.christianrobert.onig2js.transformer.builder;

import me.christianrobert.onig2js.transformer.context.ConversionContext;
import me.christianrobert.onig2js.transformer.context.MalformedTreeException;
import me.christianrobert.onig2js.transformer.context.WarningCategory;
import me.christianrobert.onig2js.transformer.leaf.LiteralNormalizer;
import me.christianrobert.onig2js.transformer.leaf.PropertyResolver;
import me.christianrobert.onig2js.transformer.node.AlternationNode;
import me.christianrobert.onig2js.transformer.node.AnchorNode;
import me.christianrobert.onig2js.transformer.node.BackreferenceNode;
import me.christianrobert.onig2js.transformer.node.CharacterTypeNode;
import me.christianrobert.onig2js.transformer.node.GroupNode;
import me.christianrobert.onig2js.transformer.node.LiteralNode;
import me.christianrobert.onig2js.transformer.node.Node;
import me.christianrobert.onig2js.transformer.node.PropertyNode;
import me.christianrobert.onig2js.transformer.node.QuantifierNode;
import me.christianrobert.onig2js.transformer.node.RootNode;
import me.christianrobert.onig2js.transformer.node.SetNode;

import java.util.List;

/**
 * Walks a pattern tree depth-first and assembles the target pattern.
 *
 * <p>Architecture: {@link #visit(Node)} dispatches on the node kind to a static
 * {@code VisitXxx.v(node, builder)} helper, which converts the node and calls back
 * into {@link #visit(Node)} for its children. All cross-node state lives in the
 * {@link ConversionContext}; the builder itself holds no state of its own.</p>
 *
 * <p>A builder and its context serve exactly one conversion.</p>
 */
public class JsRegexBuilder {

    // no logging in the builder, the service logs per conversion

    private final ConversionContext context;
    private final PropertyResolver propertyResolver;
    private final LiteralNormalizer literalNormalizer;

    public JsRegexBuilder(ConversionContext context, PropertyResolver propertyResolver,
                          LiteralNormalizer literalNormalizer) {
        if (context == null || propertyResolver == null || literalNormalizer == null) {
            throw new IllegalArgumentException("Context, property resolver and literal normalizer are required");
        }
        this.context = context;
        this.propertyResolver = propertyResolver;
        this.literalNormalizer = literalNormalizer;
    }

    public ConversionContext getContext() {
        return context;
    }

    public PropertyResolver getPropertyResolver() {
        return propertyResolver;
    }

    public LiteralNormalizer getLiteralNormalizer() {
        return literalNormalizer;
    }

    /**
     * Converts a whole tree. May only be called once per builder.
     *
     * @param root Root of the parsed pattern
     * @return Target pattern source (without delimiters and flags)
     */
    public String build(RootNode root) {
        if (root == null) {
            throw new IllegalArgumentException("Root node cannot be null");
        }
        context.start();
        try {
            return visit(root);
        } finally {
            context.complete();
        }
    }

    /**
     * Converts one node, including its subtree.
     */
    public String visit(Node node) {
        if (node == null) {
            throw new MalformedTreeException("Pattern tree contains a null node");
        }
        context.enterNode(node::getText);
        Boolean caseScope = node.getCaseInsensitive();
        if (caseScope != null) {
            context.pushCaseScope(caseScope);
        }
        try {
            return dispatch(node);
        } finally {
            if (caseScope != null) {
                context.popCaseScope();
            }
            context.exitNode();
        }
    }

    /**
     * Converts a list of sibling nodes and concatenates the results.
     */
    public String visitSequence(List<Node> nodes) {
        return VisitSequence.v(nodes, this);
    }

    private String dispatch(Node node) {
        return switch (node.getKind()) {
            case ROOT, SEQUENCE -> VisitSequence.v(node.getChildren(), this);
            case ALTERNATION -> VisitAlternation.v((AlternationNode) node, this);
            case GROUP -> VisitGroup.v((GroupNode) node, this);
            case SET -> VisitSet.v((SetNode) node, this);
            case LITERAL -> VisitLiteral.v((LiteralNode) node, this);
            case PROPERTY -> VisitProperty.v((PropertyNode) node, this);
            case CHARACTER_TYPE -> VisitCharacterType.v((CharacterTypeNode) node, this);
            case QUANTIFIER -> VisitQuantifier.v((QuantifierNode) node, this);
            case ANCHOR -> VisitAnchor.v((AnchorNode) node, this);
            case BACKREFERENCE -> VisitBackreference.v((BackreferenceNode) node, this);
            case RANGE, INTERSECTION -> throw new MalformedTreeException(
                    node.getKind() + " node found outside of a set", node.getText());
            case UNKNOWN -> {
                context.warn(WarningCategory.UNKNOWN_NODE,
                        "Replaced node of unknown kind '" + node.getText() + "' with an empty group");
                yield "(?:)";
            }
        };
    }
}
