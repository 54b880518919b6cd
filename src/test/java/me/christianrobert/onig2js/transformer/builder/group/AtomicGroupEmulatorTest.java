package me.christianrobert.onig2js.transformer.builder.group;

import me.christianrobert.onig2js.config.service.ConfigService;
import me.christianrobert.onig2js.transformer.context.ConversionResult;
import me.christianrobert.onig2js.transformer.leaf.StandardLiteralNormalizer;
import me.christianrobert.onig2js.transformer.leaf.StandardPropertyResolver;
import me.christianrobert.onig2js.transformer.node.QuantifierMode;
import me.christianrobert.onig2js.transformer.service.RegexConversionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static me.christianrobert.onig2js.transformer.node.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks that emulated atomic groups behave atomically. The emitted syntax
 * used here is shared by java.util.regex, so patterns can be executed directly.
 */
class AtomicGroupEmulatorTest {

    private RegexConversionService service;

    @BeforeEach
    void setUp() {
        service = new RegexConversionService(new ConfigService(), new StandardPropertyResolver(),
                new StandardLiteralNormalizer());
    }

    @Test
    void emulatedGroupDoesNotBacktrack() {
        // Given: 1(?>33|3)37
        ConversionResult result = service.convert(root(literal("1"), atomic(alternation("33", "3")), literal("37")));
        Pattern emulated = Pattern.compile(result.getPattern());

        // Then: same verdicts as a real atomic group
        assertTrue(emulated.matcher("13337").matches());
        assertFalse(emulated.matcher("1337").matches());

        Pattern reference = Pattern.compile("1(?>33|3)37");
        assertEquals(reference.matcher("13337").matches(), emulated.matcher("13337").matches());
        assertEquals(reference.matcher("1337").matches(), emulated.matcher("1337").matches());
    }

    @Test
    void plainGroupWouldBacktrack() {
        ConversionResult result = service.convert(root(literal("1"), passive(alternation("33", "3")), literal("37")));

        assertTrue(Pattern.compile(result.getPattern()).matcher("1337").matches());
    }

    @Test
    void emulatedPossessiveQuantifierDoesNotGiveBack() {
        // a++a never matches
        ConversionResult result = service.convert(root(quantifier(literal("a"), 1, null, QuantifierMode.POSSESSIVE),
                literal("a")));
        Pattern emulated = Pattern.compile(result.getPattern());

        for (String input : new String[]{"a", "aa", "aaa", "aaaa"}) {
            assertFalse(emulated.matcher(input).matches(), input);
            assertEquals(Pattern.matches("a++a", input), emulated.matcher(input).matches(), input);
        }
    }

    @Test
    void backreferencesStayConsistentAroundEmulation() {
        // (a|b)(?>c)\1
        ConversionResult result = service.convert(root(capture(1, alternation("a", "b")), atomic(literal("c")),
                backreference(1)));
        Pattern emulated = Pattern.compile(result.getPattern());

        assertTrue(emulated.matcher("aca").matches());
        assertTrue(emulated.matcher("bcb").matches());
        assertFalse(emulated.matcher("acb").matches());
    }
}
