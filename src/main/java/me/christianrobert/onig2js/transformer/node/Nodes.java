package me.christianrobert.onig2js.transformer.node;

import java.util.Arrays;
import java.util.List;

/**
 * Static factory for building pattern trees.
 *
 * <p>This is the construction surface used by the parser (and by tests). It takes
 * care of the bookkeeping nodes cannot do themselves: set nesting levels are
 * assigned when a set is wrapped, and case-insensitivity annotations are attached
 * to subtrees governed by inline options.</p>
 *
 * <pre>
 * // [a-z[0-9]]+
 * Nodes.root(Nodes.plus(Nodes.set(Nodes.range("a", "z"), Nodes.set(Nodes.range("0", "9")))));
 * </pre>
 */
public final class Nodes {

    private Nodes() {
    }

    // ========== Structure ==========

    public static RootNode root(Node... children) {
        return new RootNode(Arrays.asList(children), false, false, null);
    }

    public static RootNode root(boolean caseInsensitive, boolean dotAll, Node... children) {
        return new RootNode(Arrays.asList(children), caseInsensitive, dotAll, null);
    }

    public static RootNode root(String source, boolean caseInsensitive, boolean dotAll, List<Node> children) {
        return new RootNode(children, caseInsensitive, dotAll, source);
    }

    public static SequenceNode sequence(Node... children) {
        return new SequenceNode(Arrays.asList(children));
    }

    public static AlternationNode alternation(Node... branches) {
        return new AlternationNode(Arrays.asList(branches));
    }

    /**
     * Alternation of plain literal branches, e.g. {@code alternation("33", "3")} for {@code 33|3}.
     */
    public static AlternationNode alternation(String... literalBranches) {
        Node[] branches = new Node[literalBranches.length];
        for (int i = 0; i < literalBranches.length; i++) {
            branches[i] = literal(literalBranches[i]);
        }
        return alternation(branches);
    }

    // ========== Groups ==========

    public static GroupNode group(GroupType type, Node... children) {
        if (type.isCapturing()) {
            throw new IllegalArgumentException("Use capture() or named() for capturing groups");
        }
        return new GroupNode(type, Arrays.asList(children), null, null, null, null);
    }

    public static GroupNode capture(int captureIndex, Node... children) {
        return new GroupNode(GroupType.CAPTURE, Arrays.asList(children), null, captureIndex, null, null);
    }

    public static GroupNode named(String name, int captureIndex, Node... children) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Group name cannot be null or empty");
        }
        return new GroupNode(GroupType.NAMED, Arrays.asList(children), name, captureIndex, null, null);
    }

    public static GroupNode passive(Node... children) {
        return group(GroupType.PASSIVE, children);
    }

    public static GroupNode atomic(Node... children) {
        return group(GroupType.ATOMIC, children);
    }

    public static GroupNode absence(Node... children) {
        return group(GroupType.ABSENCE, children);
    }

    public static GroupNode comment(String text) {
        return group(GroupType.COMMENT, literal(text));
    }

    public static GroupNode lookahead(Node... children) {
        return group(GroupType.LOOKAHEAD, children);
    }

    public static GroupNode negativeLookahead(Node... children) {
        return group(GroupType.NEGATIVE_LOOKAHEAD, children);
    }

    public static GroupNode lookbehind(Node... children) {
        return group(GroupType.LOOKBEHIND, children);
    }

    public static GroupNode negativeLookbehind(Node... children) {
        return group(GroupType.NEGATIVE_LOOKBEHIND, children);
    }

    /**
     * Option group such as {@code (?i-m:...)}. If the {@code i} option changes, the
     * group is annotated accordingly.
     */
    public static GroupNode options(String enabled, String disabled, Node... children) {
        GroupNode group = new GroupNode(GroupType.OPTIONS, Arrays.asList(children), null, null, enabled, disabled);
        return annotateFromOptions(group, enabled, disabled);
    }

    /**
     * Option switch such as {@code (?m-x)}. The parser annotates the following
     * siblings itself (see {@link #caseInsensitive(Node, boolean)}).
     */
    public static GroupNode optionsSwitch(String enabled, String disabled) {
        return new GroupNode(GroupType.OPTIONS_SWITCH, List.of(), null, null, enabled, disabled);
    }

    public static GroupNode unknownGroup(Node... children) {
        return group(GroupType.UNKNOWN, children);
    }

    private static GroupNode annotateFromOptions(GroupNode group, String enabled, String disabled) {
        if (enabled != null && enabled.indexOf('i') >= 0) {
            group.annotateCaseInsensitive(Boolean.TRUE);
        } else if (disabled != null && disabled.indexOf('i') >= 0) {
            group.annotateCaseInsensitive(Boolean.FALSE);
        }
        return group;
    }

    // ========== Sets ==========

    public static SetNode set(Node... members) {
        return newSet(false, members);
    }

    public static SetNode negatedSet(Node... members) {
        return newSet(true, members);
    }

    private static SetNode newSet(boolean negative, Node... members) {
        SetNode set = new SetNode(Arrays.asList(members), negative, 0);
        set.assignNestingLevel(0);
        return set;
    }

    public static RangeNode range(String from, String to) {
        return new RangeNode(from, to);
    }

    public static IntersectionNode intersection() {
        return new IntersectionNode();
    }

    /**
     * One literal set member per character of {@code chars}, e.g. {@code members("abc")}.
     */
    public static Node[] members(String chars) {
        int[] codePoints = chars.codePoints().toArray();
        Node[] members = new Node[codePoints.length];
        for (int i = 0; i < codePoints.length; i++) {
            members[i] = literal(new String(Character.toChars(codePoints[i])));
        }
        return members;
    }

    // ========== Leaves ==========

    public static LiteralNode literal(String text) {
        return new LiteralNode(text);
    }

    public static PropertyNode property(String name) {
        return new PropertyNode(name, false, false, false);
    }

    public static PropertyNode property(String name, boolean upperSign, boolean caret) {
        return new PropertyNode(name, upperSign, caret, false);
    }

    public static PropertyNode posix(String name) {
        return new PropertyNode(name, false, false, true);
    }

    public static PropertyNode negatedPosix(String name) {
        return new PropertyNode(name, false, true, true);
    }

    public static CharacterTypeNode type(CharacterType type) {
        return new CharacterTypeNode(type);
    }

    public static AnchorNode anchor(AnchorKind kind) {
        return new AnchorNode(kind);
    }

    public static BackreferenceNode backreference(int number) {
        return BackreferenceNode.byNumber(number);
    }

    public static BackreferenceNode backreference(String name) {
        return BackreferenceNode.byName(name);
    }

    public static UnknownNode unknown(String text) {
        return new UnknownNode(text);
    }

    // ========== Quantifiers ==========

    public static QuantifierNode quantifier(Node child, int min, Integer max, QuantifierMode mode) {
        return new QuantifierNode(child, min, max, mode);
    }

    public static QuantifierNode quantifier(Node child, int min, Integer max) {
        return new QuantifierNode(child, min, max, QuantifierMode.GREEDY);
    }

    public static QuantifierNode star(Node child) {
        return quantifier(child, 0, null);
    }

    public static QuantifierNode plus(Node child) {
        return quantifier(child, 1, null);
    }

    public static QuantifierNode optional(Node child) {
        return quantifier(child, 0, 1);
    }

    // ========== Annotations ==========

    /**
     * Marks a subtree as governed by a case-(in)sensitive inline option scope.
     */
    public static <T extends Node> T caseInsensitive(T node, boolean caseInsensitive) {
        node.annotateCaseInsensitive(caseInsensitive);
        return node;
    }
}
