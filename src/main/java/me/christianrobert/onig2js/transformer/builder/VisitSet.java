package me.christianrobert.onig2js.transformer.builder;

import me.christianrobert.onig2js.transformer.context.ConversionContext;
import me.christianrobert.onig2js.transformer.context.MalformedTreeException;
import me.christianrobert.onig2js.transformer.context.WarningCategory;
import me.christianrobert.onig2js.transformer.leaf.CaseFolder;
import me.christianrobert.onig2js.transformer.leaf.Escapes;
import me.christianrobert.onig2js.transformer.node.CharacterTypeNode;
import me.christianrobert.onig2js.transformer.node.Node;
import me.christianrobert.onig2js.transformer.node.PropertyNode;
import me.christianrobert.onig2js.transformer.node.RangeNode;
import me.christianrobert.onig2js.transformer.node.SetNode;

import java.util.List;

/**
 * Converts character classes.
 *
 * <p>The target has no nested classes, no intersections, no {@code \h}/{@code \H}
 * and no properties inside classes, so an Onigmo class is flattened into one
 * bracket expression. Members whose meaning cannot be unioned into that bracket
 * (the non-hex type, properties) are <em>extracted</em> into standalone brackets
 * and combined with the residual bracket in a passive alternation:</p>
 *
 * <pre>
 * [a-z[0-9]]     → [a-z0-9]
 * [a-c\H]        → (?:[a-c]|[^A-Fa-f0-9])
 * [\H]           → [^A-Fa-f0-9]
 * [\H[:ascii:]]  → (?:[^A-Fa-f0-9]|[\x00-\x7F])
 * </pre>
 *
 * <p>Members of all nesting levels are written into the buffers of the
 * {@link ConversionContext}; only the outermost class (nesting level 0) produces
 * output, after all nested content has been merged.</p>
 */
public class VisitSet {

    static final String HEX_RANGES = "A-Fa-f0-9";
    static final String NONHEX_SET = "[^A-Fa-f0-9]";
    private static final String CLASS_SYNTAX = "-^]";

    public static String v(SetNode node, JsRegexBuilder b) {
        ConversionContext context = b.getContext();

        if (node.getNestingLevel() == 0) {
            context.beginSet(node.isNegative());
            try {
                processMembers(node, b);
                return finalizeSet(node, context);
            } finally {
                context.endSet();
            }
        }

        if (!context.isInSet()) {
            throw new MalformedTreeException("Nested set (level " + node.getNestingLevel() +
                    ") found outside of an outermost set", node.getText());
        }
        // positive subset: merge into the outermost set's buffers
        processMembers(node, b);
        return "";
    }

    private static void processMembers(SetNode node, JsRegexBuilder b) {
        for (Node member : node.getMembers()) {
            processMember(member, b);
        }
    }

    private static void processMember(Node member, JsRegexBuilder b) {
        ConversionContext context = b.getContext();
        switch (member.getKind()) {
            case SET -> {
                SetNode subset = (SetNode) member;
                if (!subset.isNegative()) {
                    b.visit(subset);
                } else if (context.isNegativeBaseSet()) {
                    context.warnOfUnsupported(WarningCategory.NESTED_NEGATIVE_SET, "nested negative set data");
                } else {
                    context.warnOfUnsupported(WarningCategory.NESTED_NEGATIVE_SET, "nested negative set");
                }
            }
            case LITERAL -> handleLiteral(member.getText(), b);
            case RANGE -> handleRange((RangeNode) member, b);
            case CHARACTER_TYPE -> handleType((CharacterTypeNode) member, context);
            case PROPERTY -> handleProperty((PropertyNode) member, b);
            case INTERSECTION -> context.warnOfUnsupported(WarningCategory.SET_INTERSECTION, "set intersection");
            default -> throw new MalformedTreeException(
                    "Unexpected " + member.getKind() + " node inside a set", member.getText());
        }
    }

    private static void handleLiteral(String raw, JsRegexBuilder b) {
        ConversionContext context = b.getContext();
        if (Escapes.containsAstral(raw)) {
            context.warnOfUnsupported(WarningCategory.ASTRAL_PLANE_SET_MEMBER, "astral plane set member '" + raw + "'");
            return;
        }
        String normalized = escapeClassSyntax(b.getLiteralNormalizer().normalize(raw));
        context.bufferSetMember(CaseFolder.foldSetMember(normalized, raw, context));
    }

    private static void handleRange(RangeNode range, JsRegexBuilder b) {
        ConversionContext context = b.getContext();
        if (Escapes.containsAstral(range.getFrom()) || Escapes.containsAstral(range.getTo())) {
            context.warnOfUnsupported(WarningCategory.ASTRAL_PLANE_SET_MEMBER,
                    "astral plane set member '" + range.getText() + "'");
            return;
        }
        String from = escapeClassSyntax(b.getLiteralNormalizer().normalize(range.getFrom()));
        String to = escapeClassSyntax(b.getLiteralNormalizer().normalize(range.getTo()));
        context.bufferSetMember(CaseFolder.foldSetRange(from, to, range.getText(), context));
    }

    /**
     * Escapes characters that would change meaning once members of different
     * classes are concatenated: {@code -} would form a range, {@code ^} would
     * negate the class if it lands first, {@code ]} would close it.
     */
    static String escapeClassSyntax(String normalized) {
        StringBuilder sb = new StringBuilder(normalized.length());
        int i = 0;
        while (i < normalized.length()) {
            int len = Escapes.atomLength(normalized, i);
            String atom = normalized.substring(i, i + len);
            if (Escapes.isPlainChar(atom) && CLASS_SYNTAX.indexOf(atom.charAt(0)) >= 0) {
                sb.append('\\');
            }
            sb.append(atom);
            i += len;
        }
        return sb.toString();
    }

    private static void handleType(CharacterTypeNode typeNode, ConversionContext context) {
        switch (typeNode.getType()) {
            case HEX -> context.bufferSetMember(HEX_RANGES);
            case NONHEX -> {
                if (context.isNegativeBaseSet()) {
                    context.warnOfUnsupported(WarningCategory.NONHEX_IN_NEGATIVE_SET,
                            "nonhex type in negative set");
                } else {
                    context.bufferSetExtraction(NONHEX_SET);
                }
            }
            case DIGIT, NONDIGIT, WORD, NONWORD, SPACE, NONSPACE -> context.bufferSetMember(typeNode.getText());
            default -> context.warnOfUnsupported(WarningCategory.UNSUPPORTED_TYPE,
                    "type '" + typeNode.getText() + "' in set");
        }
    }

    private static void handleProperty(PropertyNode property, JsRegexBuilder b) {
        ConversionContext context = b.getContext();
        boolean negated = property.isNegated();
        if (context.isNegativeBaseSet()) {
            negated = !negated;
        }
        String ranges = b.getPropertyResolver().resolve(property.getName());
        if (ranges == null) {
            context.warnOfUnsupported(WarningCategory.UNSUPPORTED_PROPERTY,
                    "property '" + property.getName() + "'");
        } else if (context.isNegativeBaseSet()) {
            context.warnOfUnsupported(WarningCategory.PROPERTY_IN_NEGATIVE_SET,
                    "property in negative set '" + property.getText() + "'");
        } else {
            context.bufferSetExtraction("[" + (negated ? "^" : "") + ranges + "]");
        }
    }

    private static String finalizeSet(SetNode node, ConversionContext context) {
        List<String> members = context.getBufferedSetMembers();
        List<String> extractions = context.getBufferedSetExtractions();
        if (members.isEmpty()) {
            return finalizeDepletedSet(extractions);
        }
        String set = "[" + (node.isNegative() ? "^" : "") + String.join("", members) + "]";
        if (extractions.isEmpty()) {
            return set;
        }
        return "(?:" + set + "|" + String.join("|", extractions) + ")";
    }

    private static String finalizeDepletedSet(List<String> extractions) {
        return switch (extractions.size()) {
            case 0 -> "";
            case 1 -> extractions.get(0);
            default -> "(?:" + String.join("|", extractions) + ")";
        };
    }
}
