package me.christianrobert.onig2js.transformer.builder;

import me.christianrobert.onig2js.transformer.node.Node;

import java.util.List;

/**
 * Concatenates converted siblings (root content, group content, alternation branches).
 *
 * <p>Output ending in a backreference, directly followed by a fragment starting
 * with a digit, would read as a different group number or an octal escape in the
 * target ({@code \1} + {@code 0} = {@code \10}), so an empty group is placed in
 * between. Zero-width siblings that convert to nothing, such as comments or
 * option switches, do not separate the two.</p>
 */
public class VisitSequence {

    public static String v(List<Node> nodes, JsRegexBuilder b) {
        StringBuilder result = new StringBuilder();
        for (Node node : nodes) {
            String fragment = b.visit(node);
            if (!fragment.isEmpty() && isDigit(fragment.charAt(0)) && endsWithBackreference(result)) {
                result.append("(?:)");
            }
            result.append(fragment);
        }
        return result.toString();
    }

    /**
     * @return Whether the text ends in an unescaped {@code \N} with N starting at 1-9
     */
    static boolean endsWithBackreference(CharSequence text) {
        int i = text.length() - 1;
        while (i >= 0 && isDigit(text.charAt(i))) {
            i--;
        }
        if (i == text.length() - 1 || i < 0 || text.charAt(i) != '\\' || text.charAt(i + 1) == '0') {
            return false;
        }
        int backslashes = 0;
        while (i >= 0 && text.charAt(i) == '\\') {
            backslashes++;
            i--;
        }
        return backslashes % 2 == 1;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
