package me.christianrobert.onig2js.transformer.leaf;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Default literal normalization.
 *
 * <ul>
 *   <li>Literal line terminators become escapes</li>
 *   <li>{@code \e} and {@code \a} become hex escapes</li>
 *   <li>Braced code point escapes become four-digit escapes, astral ones a surrogate pair</li>
 *   <li>{@code \C-x} becomes {@code \cX}</li>
 *   <li>Everything else, including the backspace pseudo-member {@code \b}, passes through</li>
 * </ul>
 */
@ApplicationScoped
public class StandardLiteralNormalizer implements LiteralNormalizer {

    private static final char LINE_SEPARATOR = (char) 0x2028;
    private static final char PARAGRAPH_SEPARATOR = (char) 0x2029;

    @Override
    public String normalize(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Literal text cannot be null");
        }
        StringBuilder sb = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            int len = Escapes.atomLength(raw, i);
            sb.append(normalizeAtom(raw.substring(i, i + len)));
            i += len;
        }
        return sb.toString();
    }

    private String normalizeAtom(String atom) {
        if (atom.charAt(0) != '\\') {
            char c = atom.charAt(0);
            if (c == '\n') {
                return "\\n";
            }
            if (c == '\r') {
                return "\\r";
            }
            if (c == LINE_SEPARATOR || c == PARAGRAPH_SEPARATOR) {
                return String.format("\\u%04X", (int) c);
            }
            return atom;
        }
        if (atom.length() < 2) {
            return "\\\\";
        }
        int braced = Escapes.bracedCodePoint(atom);
        if (braced >= 0) {
            return unicodeEscape(braced);
        }
        switch (atom.charAt(1)) {
            case 'e':
                return "\\x1B";
            case 'a':
                return "\\x07";
            case 'C':
                if (atom.length() == 4) {
                    return "\\c" + Character.toUpperCase(atom.charAt(3));
                }
                return atom;
            case 'c':
                if (atom.length() == 3) {
                    return "\\c" + Character.toUpperCase(atom.charAt(2));
                }
                return atom;
            default:
                return atom;
        }
    }

    private static String unicodeEscape(int codePoint) {
        StringBuilder sb = new StringBuilder();
        for (char c : Character.toChars(codePoint)) {
            sb.append(String.format("\\u%04X", (int) c));
        }
        return sb.toString();
    }
}
