package me.christianrobert.onig2js.transformer.builder.group;

import me.christianrobert.onig2js.transformer.builder.JsRegexBuilder;
import me.christianrobert.onig2js.transformer.context.WarningCategory;
import me.christianrobert.onig2js.transformer.node.GroupNode;

/**
 * Emulates absence groups, {@code (?~X)}: the longest run of text that does not
 * contain a match of X.
 *
 * <p>If X matches at least L code units and at most a bounded number, a string
 * contains X only if X starts at one of its positions. The complement is either
 * a string too short to hold X, or a run of positions at none of which X starts:</p>
 * <pre>
 * (?~23)      →  (?:(?:.|\n){0,1}|(?:(?!23)(?:.|\n))*)
 * (?~\d{4})   →  (?:(?:.|\n){0,3}|(?:(?!\d{4})(?:.|\n))*)
 * (?~)        →  (?!)
 * (?~2+)      →  (nothing), with warning
 * </pre>
 *
 * <p>Content that can match the empty string occurs everywhere, so nothing can
 * be absent of it and the group never matches.</p>
 */
public class AbsenceGroupEmulator {

    private static final String ANY_CHARACTER = "(?:.|\\n)";

    public static String emulate(GroupNode node, JsRegexBuilder b) {
        MatchLength length = MatchLengthAnalyzer.analyze(node.getChildren(), b.getContext());

        if (length.isVariable()) {
            b.getContext().warnOfUnsupported(WarningCategory.VARIABLE_LENGTH_ABSENCE,
                    "variable-length absence group content '" + node.getText() + "'");
            return "";
        }
        if (length.getMin() == 0) {
            return "(?!)";
        }

        String content = b.visitSequence(node.getChildren());
        return "(?:" + ANY_CHARACTER + "{0," + (length.getMin() - 1) + "}" +
               "|(?:(?!" + content + ")" + ANY_CHARACTER + ")*)";
    }
}
