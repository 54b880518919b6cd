package me.christianrobert.onig2js.transformer.builder;

import me.christianrobert.onig2js.transformer.context.WarningCategory;
import me.christianrobert.onig2js.transformer.node.CharacterTypeNode;

/**
 * Converts shorthand types outside of sets.
 *
 * <p>{@code \d \D \w \W \s \S} pass through. {@code \h} and {@code \H} become
 * hex-digit brackets, {@code \R} a linebreak alternation. {@code .} matches
 * newlines in Onigmo's multiline mode, which the target can only emulate.
 * {@code \X} has no equivalent.</p>
 */
public class VisitCharacterType {

    static final String LINEBREAK = "(?:\\r\\n|[\\n\\v\\f\\r\\x85\\u2028\\u2029])";

    public static String v(CharacterTypeNode node, JsRegexBuilder b) {
        switch (node.getType()) {
            case ANY:
                return b.getContext().isRootDotAll() ? "(?:.|\\n)" : ".";
            case HEX:
                return "[" + VisitSet.HEX_RANGES + "]";
            case NONHEX:
                return VisitSet.NONHEX_SET;
            case LINEBREAK:
                return LINEBREAK;
            case EXTENDED_GRAPHEME:
                b.getContext().warnOfUnsupported(WarningCategory.UNSUPPORTED_TYPE,
                        "extended grapheme type '\\X'");
                return "";
            default:
                return node.getType().getText();
        }
    }
}
