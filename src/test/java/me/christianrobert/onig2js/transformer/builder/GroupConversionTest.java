package me.christianrobert.onig2js.transformer.builder;

import me.christianrobert.onig2js.config.service.ConfigService;
import me.christianrobert.onig2js.transformer.context.ConversionResult;
import me.christianrobert.onig2js.transformer.context.WarningCategory;
import me.christianrobert.onig2js.transformer.leaf.StandardLiteralNormalizer;
import me.christianrobert.onig2js.transformer.leaf.StandardPropertyResolver;
import me.christianrobert.onig2js.transformer.node.CharacterType;
import me.christianrobert.onig2js.transformer.node.QuantifierMode;
import me.christianrobert.onig2js.transformer.node.RootNode;
import me.christianrobert.onig2js.transformer.service.RegexConversionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static me.christianrobert.onig2js.transformer.node.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for group conversion, including atomic and absence group emulation.
 */
public class GroupConversionTest {

    private RegexConversionService service;

    @BeforeEach
    void setUp() {
        service = new RegexConversionService(new ConfigService(), new StandardPropertyResolver(),
                new StandardLiteralNormalizer());
    }

    // ==================== Plain groups ====================

    @Test
    void captureGroupIsKept() {
        assertEquals("(a)", convert(root(capture(1, literal("a")))).getPattern());
    }

    @Test
    void namedGroupLosesItsName() {
        // (?<x>a)\k<x>
        ConversionResult result = convert(root(named("x", 1, literal("a")), backreference("x")));

        assertEquals("(a)\\1", result.getPattern());
        assertFalse(result.hasWarnings());
    }

    @Test
    void passiveGroupIsKept() {
        assertEquals("(?:ab)", convert(root(passive(literal("ab")))).getPattern());
    }

    @Test
    void commentIsRemovedSilently() {
        ConversionResult result = convert(root(literal("a"), comment("note"), literal("b")));

        assertEquals("ab", result.getPattern());
        assertFalse(result.hasWarnings());
    }

    @Test
    void lookaheadsPassThrough() {
        assertEquals("(?=a)(?!b)", convert(root(lookahead(literal("a")), negativeLookahead(literal("b")))).getPattern());
    }

    @Test
    void lookbehindIsDowngradedToPassiveGroup() {
        ConversionResult result = convert(root(lookbehind(literal("a")), literal("b")));

        assertEquals("(?:a)b", result.getPattern());
        assertEquals(1, result.getWarnings().size());
        assertEquals(WarningCategory.LOOKBEHIND, result.getWarnings().get(0).getCategory());
        assertTrue(result.getWarnings().get(0).getMessage().contains("(?<=a)"));
    }

    @Test
    void negativeLookbehindIsDropped() {
        ConversionResult result = convert(root(negativeLookbehind(literal("a")), literal("b")));

        assertEquals("b", result.getPattern());
        assertEquals("Dropped unsupported negative lookbehind '(?<!a)'", result.getWarnings().get(0).getMessage());
    }

    @Test
    void unknownGroupBecomesEmptyGroup() {
        ConversionResult result = convert(root(unknownGroup(literal("a"))));

        assertTrue(result.isSuccess());
        assertEquals("(?:)", result.getPattern());
        assertEquals(WarningCategory.UNKNOWN_GROUP, result.getWarnings().get(0).getCategory());
        assertEquals("Replaced group of unknown kind '(?a)' with an empty group",
                result.getWarnings().get(0).getMessage());
    }

    // ==================== Options ====================

    @Test
    void optionSwitchWithInPatternOptionsEmitsNothing() {
        ConversionResult result = convert(root(optionsSwitch("m", "x"), literal("a")));

        assertEquals("a", result.getPattern());
        assertFalse(result.hasWarnings());
    }

    @Test
    void optionSwitchWithEncodingOptionsWarns() {
        ConversionResult result = convert(root(optionsSwitch("adu", ""), literal("a")));

        assertEquals("a", result.getPattern());
        assertEquals(1, result.getWarnings().size());
        assertEquals(WarningCategory.ENCODING_OPTIONS, result.getWarnings().get(0).getCategory());
        assertEquals("Dropped unsupported encoding options [\"a\", \"d\", \"u\"]",
                result.getWarnings().get(0).getMessage());
    }

    @Test
    void optionGroupBecomesPassiveGroup() {
        ConversionResult result = convert(root(options("m", "", literal("a")), capture(1, literal("b")), backreference(1)));

        // no capture is introduced, so numbering is unaffected
        assertEquals("(?:a)(b)\\1", result.getPattern());
        assertFalse(result.hasWarnings());
    }

    // ==================== Atomic groups ====================

    @Test
    void atomicGroupIsEmulated() {
        // Given: 1(?>33|3)37
        RootNode root = root(literal("1"), atomic(alternation("33", "3")), literal("37"));

        // When
        ConversionResult result = convert(root);

        // Then
        assertEquals("1(?=(33|3))\\1(?:)37", result.getPattern());
        assertFalse(result.hasWarnings());
    }

    @Test
    void atomicBackreferenceCountsPrecedingCaptures() {
        // (a)(?>b)(c)(?>d)\2
        RootNode root = root(capture(1, literal("a")), atomic(literal("b")), capture(2, literal("c")),
                atomic(literal("d")), backreference(2));

        assertEquals("(a)(?=(b))\\2(?:)(c)(?=(d))\\4(?:)\\3", convert(root).getPattern());
    }

    @Test
    void capturesNestedInOtherGroupsAreCounted() {
        // (?:(a))(?=(b))(?>c)
        RootNode root = root(passive(capture(1, literal("a"))), lookahead(capture(2, literal("b"))),
                atomic(literal("c")));

        assertEquals("(?:(a))(?=(b))(?=(c))\\3(?:)", convert(root).getPattern());
    }

    @Test
    void captureInsideAtomicGroupIsShifted() {
        // (?>(a))\1
        RootNode root = root(atomic(capture(1, literal("a"))), backreference(1));

        assertEquals("(?=((a)))\\1(?:)\\2", convert(root).getPattern());
    }

    @Test
    void nestedAtomicGroupBecomesPassive() {
        // (?>a(?>b))
        ConversionResult result = convert(root(atomic(literal("a"), atomic(literal("b")))));

        assertEquals("(?=(a(?:b)))\\1(?:)", result.getPattern());
        assertEquals(1, result.getWarnings().size());
        assertEquals(WarningCategory.NESTED_ATOMIC_GROUP, result.getWarnings().get(0).getCategory());
    }

    @Test
    void atomicGroupsAfterANestedOneAreEmulatedAgain() {
        // (?>(?>a))(?>b)
        ConversionResult result = convert(root(atomic(atomic(literal("a"))), atomic(literal("b"))));

        assertEquals("(?=((?:a)))\\1(?:)(?=(b))\\2(?:)", result.getPattern());
    }

    @Test
    void possessiveQuantifierIsEmulated() {
        ConversionResult result = convert(root(quantifier(literal("a"), 1, null, QuantifierMode.POSSESSIVE)));

        assertEquals("(?=(a+))\\1(?:)", result.getPattern());
        assertFalse(result.hasWarnings());
    }

    @Test
    void possessiveQuantifierInsideAtomicGroupBecomesGreedy() {
        ConversionResult result = convert(root(atomic(quantifier(literal("a"), 0, null, QuantifierMode.POSSESSIVE))));

        assertEquals("(?=(a*))\\1(?:)", result.getPattern());
        assertEquals(1, result.getWarnings().size());
        assertEquals(WarningCategory.NESTED_ATOMIC_GROUP, result.getWarnings().get(0).getCategory());
    }

    @Test
    void quantifiedAtomicGroupIsWrapped() {
        // (?>a)+
        assertEquals("(?:(?=(a))\\1(?:))+", convert(root(plus(atomic(literal("a"))))).getPattern());
    }

    // ==================== Absence groups ====================

    @Test
    void variableLengthAbsenceGroupIsDropped() {
        // Given: 1(?~2+)3
        RootNode root = root(literal("1"), absence(plus(literal("2"))), literal("3"));

        // When
        ConversionResult result = convert(root);

        // Then
        assertEquals("13", result.getPattern());
        assertEquals(1, result.getWarnings().size());
        assertEquals(WarningCategory.VARIABLE_LENGTH_ABSENCE, result.getWarnings().get(0).getCategory());
        assertTrue(result.getWarnings().get(0).getMessage().contains("variable-length absence group content"));
    }

    @Test
    void fixedLengthAbsenceGroupIsEmulated() {
        // (?~23)
        assertEquals("(?:(?:.|\\n){0,1}|(?:(?!23)(?:.|\\n))*)", convert(root(absence(literal("23")))).getPattern());
    }

    @Test
    void absenceOfQuantifiedTypeUsesRepetitionLength() {
        // (?~\d{4})
        RootNode root = root(absence(quantifier(type(CharacterType.DIGIT), 4, 4)));

        assertEquals("(?:(?:.|\\n){0,3}|(?:(?!\\d{4})(?:.|\\n))*)", convert(root).getPattern());
    }

    @Test
    void absenceOfSameLengthAlternationIsEmulated() {
        // (?~ab|cd)
        RootNode root = root(absence(alternation("ab", "cd")));

        assertEquals("(?:(?:.|\\n){0,1}|(?:(?!ab|cd)(?:.|\\n))*)", convert(root).getPattern());
    }

    @Test
    void absenceOfDifferingLengthAlternationIsDropped() {
        ConversionResult result = convert(root(absence(alternation("ab", "c"))));

        assertEquals("", result.getPattern());
        assertEquals(WarningCategory.VARIABLE_LENGTH_ABSENCE, result.getWarnings().get(0).getCategory());
    }

    @Test
    void emptyAbsenceGroupNeverMatches() {
        assertEquals("(?!)", convert(root(absence())).getPattern());
        assertEquals("(?!)", convert(root(absence(optional(literal("a"))))).getPattern());
    }

    private ConversionResult convert(RootNode root) {
        return service.convert(root);
    }
}
