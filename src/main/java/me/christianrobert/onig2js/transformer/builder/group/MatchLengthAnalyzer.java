package me.christianrobert.onig2js.transformer.builder.group;

import me.christianrobert.onig2js.transformer.context.ConversionContext;
import me.christianrobert.onig2js.transformer.leaf.Escapes;
import me.christianrobert.onig2js.transformer.node.AlternationNode;
import me.christianrobert.onig2js.transformer.node.CharacterTypeNode;
import me.christianrobert.onig2js.transformer.node.GroupNode;
import me.christianrobert.onig2js.transformer.node.Node;
import me.christianrobert.onig2js.transformer.node.QuantifierNode;

import java.util.List;

/**
 * Static analysis of how many code units a subtree can match.
 *
 * <p>Zero-width constructs (anchors, lookarounds, comments, option switches)
 * contribute nothing. Sets, properties and single-character types match one
 * code unit. Literals match their code unit count.</p>
 *
 * <p>When a context is given, every analyzed level counts against its nesting
 * bound, so content nested too deeply fails the same way conversion does.</p>
 */
public class MatchLengthAnalyzer {

    public static MatchLength analyze(List<Node> nodes) {
        return analyze(nodes, null);
    }

    public static MatchLength analyze(Node node) {
        return analyze(node, null);
    }

    /**
     * @param context Context whose nesting bound applies, or null for no bound
     */
    public static MatchLength analyze(List<Node> nodes, ConversionContext context) {
        MatchLength total = MatchLength.ZERO;
        for (Node node : nodes) {
            total = total.then(analyze(node, context));
            if (total.isVariable()) {
                return total;
            }
        }
        return total;
    }

    private static MatchLength analyze(Node node, ConversionContext context) {
        if (context == null) {
            return analyzeNode(node, null);
        }
        context.enterNode(node::getText);
        try {
            return analyzeNode(node, context);
        } finally {
            context.exitNode();
        }
    }

    private static MatchLength analyzeNode(Node node, ConversionContext context) {
        return switch (node.getKind()) {
            case ROOT, SEQUENCE -> analyze(node.getChildren(), context);
            case ALTERNATION -> analyzeAlternation((AlternationNode) node, context);
            case GROUP -> analyzeGroup((GroupNode) node, context);
            case SET, PROPERTY -> MatchLength.ONE;
            case LITERAL -> MatchLength.fixed(Escapes.codeUnitLength(node.getText()));
            case CHARACTER_TYPE -> analyzeType((CharacterTypeNode) node);
            case QUANTIFIER -> analyzeQuantifier((QuantifierNode) node, context);
            case ANCHOR -> MatchLength.ZERO;
            case BACKREFERENCE, RANGE, INTERSECTION, UNKNOWN -> MatchLength.VARIABLE;
        };
    }

    // Branches of differing lengths cannot be complemented by one length bound.
    private static MatchLength analyzeAlternation(AlternationNode node, ConversionContext context) {
        MatchLength common = null;
        for (Node branch : node.getBranches()) {
            MatchLength length = analyze(branch, context);
            if (length.isVariable() || (common != null && !common.equals(length))) {
                return MatchLength.VARIABLE;
            }
            common = length;
        }
        return common != null ? common : MatchLength.ZERO;
    }

    private static MatchLength analyzeGroup(GroupNode node, ConversionContext context) {
        return switch (node.getType()) {
            case CAPTURE, NAMED, PASSIVE, ATOMIC, OPTIONS -> analyze(node.getChildren(), context);
            case COMMENT, OPTIONS_SWITCH, LOOKAHEAD, NEGATIVE_LOOKAHEAD, LOOKBEHIND, NEGATIVE_LOOKBEHIND ->
                    MatchLength.ZERO;
            case ABSENCE, UNKNOWN -> MatchLength.VARIABLE;
        };
    }

    private static MatchLength analyzeType(CharacterTypeNode node) {
        return switch (node.getType()) {
            case LINEBREAK -> MatchLength.of(1, 2);
            case EXTENDED_GRAPHEME -> MatchLength.VARIABLE;
            default -> MatchLength.ONE;
        };
    }

    private static MatchLength analyzeQuantifier(QuantifierNode node, ConversionContext context) {
        if (node.isUnbounded()) {
            return MatchLength.VARIABLE;
        }
        return analyze(node.getChild(), context).repeat(node.getMin(), node.getMax());
    }
}
