package me.christianrobert.onig2js.transformer.builder;

import me.christianrobert.onig2js.transformer.builder.group.AtomicGroupEmulator;
import me.christianrobert.onig2js.transformer.leaf.Escapes;
import me.christianrobert.onig2js.transformer.node.GroupNode;
import me.christianrobert.onig2js.transformer.node.GroupType;
import me.christianrobert.onig2js.transformer.node.Node;
import me.christianrobert.onig2js.transformer.node.QuantifierMode;
import me.christianrobert.onig2js.transformer.node.QuantifierNode;

/**
 * Appends quantifier syntax to the converted child.
 *
 * <p>Greedy and reluctant quantifiers keep their syntax ({@code {,n}} is written
 * as {@code {0,n}}). Possessive quantifiers do not exist in the target and are
 * emulated as an atomic group around the greedy form:
 * {@code a++} → {@code (?=(a+))\1(?:)}.</p>
 *
 * <p>The child is wrapped in a passive group when its conversion is not a single
 * atom, e.g. a multi-character literal, an emulated group, or empty because
 * content was dropped.</p>
 */
public class VisitQuantifier {

    public static String v(QuantifierNode node, JsRegexBuilder b) {
        if (node.getMode() == QuantifierMode.POSSESSIVE) {
            return AtomicGroupEmulator.emulate(() -> quantify(node, b, ""), b, false,
                    "Converted nested possessive quantifier '" + node.getText() + "' into a greedy one");
        }
        return quantify(node, b, node.getMode().getSuffix());
    }

    private static String quantify(QuantifierNode node, JsRegexBuilder b, String suffix) {
        Node child = node.getChild();
        String converted = b.visit(child);
        if (needsGrouping(child, converted)) {
            converted = "(?:" + converted + ")";
        }
        return converted + node.getQuantifierText() + suffix;
    }

    private static boolean needsGrouping(Node child, String converted) {
        if (converted.isEmpty()) {
            return true;
        }
        switch (child.getKind()) {
            case LITERAL:
                return Escapes.codeUnitLength(child.getText()) > 1;
            case SEQUENCE:
            case ALTERNATION:
            case QUANTIFIER:
            case ANCHOR:
                return true;
            case GROUP:
                // emulations are lookahead constructs followed by more atoms
                GroupType type = ((GroupNode) child).getType();
                return type == GroupType.ATOMIC || type == GroupType.ABSENCE;
            default:
                return false;
        }
    }
}
