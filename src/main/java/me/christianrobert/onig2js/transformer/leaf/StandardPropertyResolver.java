package me.christianrobert.onig2js.transformer.leaf;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntPredicate;

/**
 * Resolves properties against the JDK's Unicode tables, restricted to the basic plane.
 *
 * <p>Supported names (matched case-insensitively, ignoring spaces, underscores and hyphens):
 * <ul>
 *   <li>POSIX classes: alnum, alpha, ascii, blank, cntrl, digit, graph, lower, print,
 *       punct, space, upper, xdigit, word</li>
 *   <li>General categories, short and long form: L, Lu, Letter, Uppercase_Letter, ...</li>
 *   <li>Binary properties: Alphabetic, Uppercase, Lowercase, White_Space, Ideographic,
 *       Hex_Digit, ASCII_Hex_Digit (AHex), Any</li>
 *   <li>Scripts (Greek, Latn, ...) and blocks with an {@code In_} prefix</li>
 * </ul>
 *
 * <p>Properties with no member in the basic plane (e.g. Deseret) are unsupported.
 * Results are cached; the resolver is safe for concurrent use.</p>
 */
@ApplicationScoped
public class StandardPropertyResolver implements PropertyResolver {

    private static final Logger log = LoggerFactory.getLogger(StandardPropertyResolver.class);

    private static final int BMP_MAX = 0xFFFF;
    private static final String UNSUPPORTED = "";

    private static final Map<String, String> FIXED_RANGES = new HashMap<>();
    private static final Map<String, IntPredicate> PREDICATES = new HashMap<>();

    static {
        FIXED_RANGES.put("ascii", "\\x00-\\x7F");
        FIXED_RANGES.put("any", "\\x00-\\uFFFF");

        IntPredicate asciiHex = cp -> (cp >= '0' && cp <= '9') || (cp >= 'A' && cp <= 'F') || (cp >= 'a' && cp <= 'f');
        IntPredicate alpha = Character::isAlphabetic;
        IntPredicate digit = cp -> Character.getType(cp) == Character.DECIMAL_DIGIT_NUMBER;
        IntPredicate space = cp -> Character.isWhitespace(cp) || Character.isSpaceChar(cp) || cp == 0x85;
        IntPredicate control = cp -> Character.getType(cp) == Character.CONTROL;
        IntPredicate punct = cp -> isAnyType(cp, Character.CONNECTOR_PUNCTUATION, Character.DASH_PUNCTUATION,
                Character.START_PUNCTUATION, Character.END_PUNCTUATION, Character.INITIAL_QUOTE_PUNCTUATION,
                Character.FINAL_QUOTE_PUNCTUATION, Character.OTHER_PUNCTUATION);
        IntPredicate graph = cp -> !space.test(cp) && !control.test(cp)
                && Character.getType(cp) != Character.UNASSIGNED && Character.getType(cp) != Character.SURROGATE;

        // POSIX
        PREDICATES.put("alpha", alpha);
        PREDICATES.put("alnum", cp -> alpha.test(cp) || digit.test(cp));
        PREDICATES.put("blank", cp -> cp == '\t' || Character.getType(cp) == Character.SPACE_SEPARATOR);
        PREDICATES.put("cntrl", control);
        PREDICATES.put("digit", digit);
        PREDICATES.put("graph", graph);
        PREDICATES.put("lower", Character::isLowerCase);
        PREDICATES.put("print", cp -> graph.test(cp) || Character.getType(cp) == Character.SPACE_SEPARATOR);
        PREDICATES.put("punct", punct);
        PREDICATES.put("space", space);
        PREDICATES.put("upper", Character::isUpperCase);
        PREDICATES.put("xdigit", asciiHex);
        PREDICATES.put("word", cp -> alpha.test(cp) || digit.test(cp)
                || isAnyType(cp, Character.NON_SPACING_MARK, Character.COMBINING_SPACING_MARK,
                Character.ENCLOSING_MARK, Character.CONNECTOR_PUNCTUATION));

        // Binary properties
        PREDICATES.put("alphabetic", alpha);
        PREDICATES.put("uppercase", Character::isUpperCase);
        PREDICATES.put("lowercase", Character::isLowerCase);
        PREDICATES.put("whitespace", space);
        PREDICATES.put("ideographic", Character::isIdeographic);
        PREDICATES.put("ahex", asciiHex);
        PREDICATES.put("asciihexdigit", asciiHex);
        IntPredicate hexDigit = cp -> asciiHex.test(cp)
                || (cp >= 0xFF10 && cp <= 0xFF19) || (cp >= 0xFF21 && cp <= 0xFF26) || (cp >= 0xFF41 && cp <= 0xFF46);
        PREDICATES.put("hexdigit", hexDigit);
        PREDICATES.put("hex", hexDigit);

        // General categories
        category("l", "letter", Character.UPPERCASE_LETTER, Character.LOWERCASE_LETTER, Character.TITLECASE_LETTER,
                Character.MODIFIER_LETTER, Character.OTHER_LETTER);
        category("lu", "uppercaseletter", Character.UPPERCASE_LETTER);
        category("ll", "lowercaseletter", Character.LOWERCASE_LETTER);
        category("lt", "titlecaseletter", Character.TITLECASE_LETTER);
        category("lm", "modifierletter", Character.MODIFIER_LETTER);
        category("lo", "otherletter", Character.OTHER_LETTER);
        category("m", "mark", Character.NON_SPACING_MARK, Character.COMBINING_SPACING_MARK, Character.ENCLOSING_MARK);
        category("mn", "nonspacingmark", Character.NON_SPACING_MARK);
        category("mc", "spacingmark", Character.COMBINING_SPACING_MARK);
        category("me", "enclosingmark", Character.ENCLOSING_MARK);
        category("n", "number", Character.DECIMAL_DIGIT_NUMBER, Character.LETTER_NUMBER, Character.OTHER_NUMBER);
        category("nd", "decimalnumber", Character.DECIMAL_DIGIT_NUMBER);
        category("nl", "letternumber", Character.LETTER_NUMBER);
        category("no", "othernumber", Character.OTHER_NUMBER);
        category("p", "punctuation", Character.CONNECTOR_PUNCTUATION, Character.DASH_PUNCTUATION,
                Character.START_PUNCTUATION, Character.END_PUNCTUATION, Character.INITIAL_QUOTE_PUNCTUATION,
                Character.FINAL_QUOTE_PUNCTUATION, Character.OTHER_PUNCTUATION);
        category("pc", "connectorpunctuation", Character.CONNECTOR_PUNCTUATION);
        category("pd", "dashpunctuation", Character.DASH_PUNCTUATION);
        category("ps", "openpunctuation", Character.START_PUNCTUATION);
        category("pe", "closepunctuation", Character.END_PUNCTUATION);
        category("pi", "initialpunctuation", Character.INITIAL_QUOTE_PUNCTUATION);
        category("pf", "finalpunctuation", Character.FINAL_QUOTE_PUNCTUATION);
        category("po", "otherpunctuation", Character.OTHER_PUNCTUATION);
        category("s", "symbol", Character.MATH_SYMBOL, Character.CURRENCY_SYMBOL, Character.MODIFIER_SYMBOL,
                Character.OTHER_SYMBOL);
        category("sm", "mathsymbol", Character.MATH_SYMBOL);
        category("sc", "currencysymbol", Character.CURRENCY_SYMBOL);
        category("sk", "modifiersymbol", Character.MODIFIER_SYMBOL);
        category("so", "othersymbol", Character.OTHER_SYMBOL);
        category("z", "separator", Character.SPACE_SEPARATOR, Character.LINE_SEPARATOR, Character.PARAGRAPH_SEPARATOR);
        category("zs", "spaceseparator", Character.SPACE_SEPARATOR);
        category("zl", "lineseparator", Character.LINE_SEPARATOR);
        category("zp", "paragraphseparator", Character.PARAGRAPH_SEPARATOR);
        category("c", "other", Character.CONTROL, Character.FORMAT, Character.SURROGATE, Character.PRIVATE_USE,
                Character.UNASSIGNED);
        category("cc", "control", Character.CONTROL);
        category("cf", "format", Character.FORMAT);
        category("cs", "surrogate", Character.SURROGATE);
        category("co", "privateuse", Character.PRIVATE_USE);
        category("cn", "unassigned", Character.UNASSIGNED);
    }

    private final Map<String, String> cache = new ConcurrentHashMap<>();

    @Override
    public String resolve(String name) {
        if (name == null || name.trim().isEmpty()) {
            return null;
        }
        String key = normalizeName(name);
        String ranges = cache.computeIfAbsent(key, k -> compute(k, name));
        return UNSUPPORTED.equals(ranges) ? null : ranges;
    }

    private String compute(String key, String originalName) {
        String fixed = FIXED_RANGES.get(key);
        if (fixed != null) {
            return fixed;
        }
        IntPredicate predicate = PREDICATES.get(key);
        if (predicate == null) {
            predicate = scriptOrBlockPredicate(originalName.trim());
        }
        if (predicate == null) {
            log.debug("Property '{}' is not known", originalName);
            return UNSUPPORTED;
        }
        String ranges = renderRanges(predicate);
        if (ranges.isEmpty()) {
            log.debug("Property '{}' has no members in the basic plane", originalName);
            return UNSUPPORTED;
        }
        return ranges;
    }

    private static IntPredicate scriptOrBlockPredicate(String name) {
        String canonical = name.replace(' ', '_').replace('-', '_');
        if (canonical.regionMatches(true, 0, "In", 0, 2)) {
            String blockName = canonical.regionMatches(true, 0, "In_", 0, 3)
                    ? canonical.substring(3) : canonical.substring(2);
            Character.UnicodeBlock block = findBlock(blockName);
            if (block != null) {
                return cp -> Character.UnicodeBlock.of(cp) == block;
            }
        }
        Character.UnicodeScript script = findScript(canonical);
        if (script != null) {
            return cp -> Character.UnicodeScript.of(cp) == script;
        }
        return null;
    }

    private static Character.UnicodeBlock findBlock(String name) {
        try {
            return Character.UnicodeBlock.forName(name);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static Character.UnicodeScript findScript(String name) {
        try {
            return Character.UnicodeScript.forName(name);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String renderRanges(IntPredicate predicate) {
        StringBuilder sb = new StringBuilder();
        int cp = 0;
        while (cp <= BMP_MAX) {
            if (!predicate.test(cp)) {
                cp++;
                continue;
            }
            int start = cp;
            while (cp + 1 <= BMP_MAX && predicate.test(cp + 1)) {
                cp++;
            }
            sb.append(escape(start));
            if (cp > start) {
                sb.append('-').append(escape(cp));
            }
            cp++;
        }
        return sb.toString();
    }

    private static String escape(int codePoint) {
        return String.format("\\u%04X", codePoint);
    }

    static String normalizeName(String name) {
        StringBuilder sb = new StringBuilder();
        for (char c : name.trim().toCharArray()) {
            if (c != ' ' && c != '_' && c != '-') {
                sb.append(c);
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static void category(String shortName, String longName, int... types) {
        IntPredicate predicate = cp -> isAnyType(cp, types);
        PREDICATES.put(shortName, predicate);
        PREDICATES.put(longName, predicate);
    }

    private static boolean isAnyType(int codePoint, int... types) {
        int type = Character.getType(codePoint);
        for (int t : types) {
            if (t == type) {
                return true;
            }
        }
        return false;
    }
}
