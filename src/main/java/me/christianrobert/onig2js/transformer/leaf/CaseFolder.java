package me.christianrobert.onig2js.transformer.leaf;

import me.christianrobert.onig2js.transformer.context.ConversionContext;
import me.christianrobert.onig2js.transformer.context.WarningCategory;

/**
 * Emulates inline case-insensitivity by adding case-swapped duplicates.
 *
 * <p>The target has no local {@code i} option. Inside a locally case-insensitive
 * scope each letter gets its swapped counterpart: {@code a} becomes {@code [aA]}
 * outside sets and {@code aA} inside sets, a range such as {@code a-f} becomes
 * {@code a-fA-F}. A range is only swapped if every character in it maps to the
 * same offset in the swapped range; otherwise the range is kept as-is and a
 * warning is recorded.</p>
 *
 * <p>Inside a locally case-sensitive scope of a case-insensitive pattern nothing
 * can be done; content with cased letters is kept and warned about.</p>
 */
public final class CaseFolder {

    private CaseFolder() {
    }

    /**
     * Folds a normalized literal outside of sets.
     */
    public static String foldLiteral(String normalized, String sourceText, ConversionContext context) {
        if (context.isLocallyCaseInsensitive()) {
            StringBuilder sb = new StringBuilder();
            int i = 0;
            while (i < normalized.length()) {
                int len = Escapes.atomLength(normalized, i);
                String atom = normalized.substring(i, i + len);
                char swapped = Escapes.isPlainChar(atom) ? swapCase(atom.charAt(0)) : 0;
                if (swapped != 0) {
                    sb.append('[').append(atom).append(swapped).append(']');
                } else {
                    sb.append(atom);
                }
                i += len;
            }
            return sb.toString();
        }
        if (context.isLocallyCaseSensitive() && hasCasedLetter(normalized)) {
            context.warn(WarningCategory.NESTED_CASE_SENSITIVE,
                    "Kept nested case-sensitive literal '" + sourceText + "' as case-insensitive");
        }
        return normalized;
    }

    /**
     * Folds a normalized single-literal set member.
     */
    public static String foldSetMember(String normalized, String sourceText, ConversionContext context) {
        if (context.isLocallyCaseInsensitive()) {
            char swapped = Escapes.isPlainChar(normalized) ? swapCase(normalized.charAt(0)) : 0;
            return swapped != 0 ? normalized + swapped : normalized;
        }
        warnIfLocallyCaseSensitive(normalized, sourceText, context);
        return normalized;
    }

    /**
     * Folds a set range whose endpoints are already normalized.
     *
     * @return Range text, followed by the swapped range when one can be added legally
     */
    public static String foldSetRange(String from, String to, String sourceText, ConversionContext context) {
        String range = from + "-" + to;
        if (context.isLocallyCaseInsensitive()) {
            if (!Escapes.isPlainChar(from) || !Escapes.isPlainChar(to)) {
                return range;
            }
            char start = from.charAt(0);
            char end = to.charAt(0);
            if (!containsCasedLetter(start, end)) {
                return range;
            }
            if (!isSwappable(start, end)) {
                context.warn(WarningCategory.NESTED_CASE_INSENSITIVE_RANGE,
                        "Dropped unsupported nested case-insensitive range '" + sourceText + "'");
                return range;
            }
            return range + swapCase(start) + "-" + swapCase(end);
        }
        warnIfLocallyCaseSensitive(range, sourceText, context);
        return range;
    }

    private static void warnIfLocallyCaseSensitive(String text, String sourceText, ConversionContext context) {
        if (context.isLocallyCaseSensitive() && hasCasedLetter(text)) {
            context.warn(WarningCategory.NESTED_CASE_SENSITIVE,
                    "Kept nested case-sensitive set member '" + sourceText + "' as case-insensitive");
        }
    }

    /**
     * @return The case-swapped character, or 0 if the character has no
     *         round-tripping counterpart
     */
    static char swapCase(char c) {
        char swapped;
        if (Character.isUpperCase(c)) {
            swapped = Character.toLowerCase(c);
        } else if (Character.isLowerCase(c)) {
            swapped = Character.toUpperCase(c);
        } else {
            return 0;
        }
        if (swapped == c) {
            return 0;
        }
        char back = Character.isUpperCase(swapped) ? Character.toLowerCase(swapped) : Character.toUpperCase(swapped);
        return back == c ? swapped : 0;
    }

    private static boolean containsCasedLetter(char start, char end) {
        for (int c = start; c <= end; c++) {
            if (swapCase((char) c) != 0) {
                return true;
            }
        }
        return false;
    }

    // Every member must swap, and to the same offset, so the swapped range is contiguous.
    private static boolean isSwappable(char start, char end) {
        char swappedStart = swapCase(start);
        if (swappedStart == 0) {
            return false;
        }
        int offset = swappedStart - start;
        for (int c = start; c <= end; c++) {
            char swapped = swapCase((char) c);
            if (swapped == 0 || swapped - c != offset) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasCasedLetter(String text) {
        int i = 0;
        while (i < text.length()) {
            int len = Escapes.atomLength(text, i);
            String atom = text.substring(i, i + len);
            if (Escapes.isPlainChar(atom) && swapCase(atom.charAt(0)) != 0) {
                return true;
            }
            i += len;
        }
        return false;
    }
}
