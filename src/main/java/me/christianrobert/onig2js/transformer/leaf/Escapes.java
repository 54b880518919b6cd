package me.christianrobert.onig2js.transformer.leaf;

/**
 * Helpers for walking raw literal text one atom at a time.
 *
 * <p>An atom is either a single (possibly supplementary) character or a complete
 * escape sequence such as {@code \x41}, a braced code point escape,
 * {@code \cA} or {@code \C-a}.</p>
 */
public final class Escapes {

    private Escapes() {
    }

    /**
     * Length in chars of the atom starting at {@code index}.
     */
    public static int atomLength(String text, int index) {
        if (text.charAt(index) != '\\') {
            return Character.charCount(text.codePointAt(index));
        }
        if (index + 1 >= text.length()) {
            return 1;
        }
        char next = text.charAt(index + 1);
        int pos = index + 2;
        switch (next) {
            case 'x', 'u' -> {
                if (pos < text.length() && text.charAt(pos) == '{') {
                    int close = text.indexOf('}', pos);
                    return close < 0 ? text.length() - index : close + 1 - index;
                }
                int maxDigits = next == 'x' ? 2 : 4;
                return 2 + countHexDigits(text, pos, maxDigits);
            }
            case 'c' -> {
                return Math.min(3, text.length() - index);
            }
            case 'C', 'M' -> {
                if (pos < text.length() && text.charAt(pos) == '-') {
                    return Math.min(4, text.length() - index);
                }
                return 2;
            }
            case '0', '1', '2', '3', '4', '5', '6', '7' -> {
                int digits = 0;
                while (digits < 2 && pos + digits < text.length() && isOctal(text.charAt(pos + digits))) {
                    digits++;
                }
                return 2 + digits;
            }
            default -> {
                return 1 + Character.charCount(text.codePointAt(index + 1));
            }
        }
    }

    /**
     * Code point denoted by a braced hex escape (x or u followed by braces), or -1
     * if the atom is not a braced escape.
     */
    public static int bracedCodePoint(String atom) {
        if (atom.length() < 5 || atom.charAt(0) != '\\' || atom.charAt(2) != '{' || !atom.endsWith("}")) {
            return -1;
        }
        char kind = atom.charAt(1);
        if (kind != 'x' && kind != 'u') {
            return -1;
        }
        try {
            return Integer.parseInt(atom.substring(3, atom.length() - 1).trim(), 16);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * Number of target code units the raw literal matches. Characters outside
     * the basic plane count twice.
     */
    public static int codeUnitLength(String raw) {
        int units = 0;
        int i = 0;
        while (i < raw.length()) {
            int len = atomLength(raw, i);
            String atom = raw.substring(i, i + len);
            units += isAstralAtom(atom) ? 2 : 1;
            i += len;
        }
        return units;
    }

    /**
     * True if any atom of the raw literal lies outside the basic plane.
     */
    public static boolean containsAstral(String raw) {
        int i = 0;
        while (i < raw.length()) {
            int len = atomLength(raw, i);
            if (isAstralAtom(raw.substring(i, i + len))) {
                return true;
            }
            i += len;
        }
        return false;
    }

    static boolean isAstralAtom(String atom) {
        if (atom.charAt(0) != '\\') {
            return atom.codePointAt(0) > 0xFFFF;
        }
        return bracedCodePoint(atom) > 0xFFFF;
    }

    /**
     * True if the text is a single unescaped basic-plane character.
     */
    public static boolean isPlainChar(String text) {
        return text.length() == 1 && text.charAt(0) != '\\' && !Character.isSurrogate(text.charAt(0));
    }

    private static int countHexDigits(String text, int from, int max) {
        int count = 0;
        while (count < max && from + count < text.length()
                && Character.digit(text.charAt(from + count), 16) >= 0) {
            count++;
        }
        return count;
    }

    private static boolean isOctal(char c) {
        return c >= '0' && c <= '7';
    }
}
