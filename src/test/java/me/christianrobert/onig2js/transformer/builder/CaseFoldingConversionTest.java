package me.christianrobert.onig2js.transformer.builder;

import me.christianrobert.onig2js.config.service.ConfigService;
import me.christianrobert.onig2js.transformer.context.ConversionResult;
import me.christianrobert.onig2js.transformer.context.WarningCategory;
import me.christianrobert.onig2js.transformer.leaf.StandardLiteralNormalizer;
import me.christianrobert.onig2js.transformer.leaf.StandardPropertyResolver;
import me.christianrobert.onig2js.transformer.node.RootNode;
import me.christianrobert.onig2js.transformer.service.RegexConversionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static me.christianrobert.onig2js.transformer.node.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for inline case-insensitivity, which the target can only express
 * through case-swapped duplicates.
 */
public class CaseFoldingConversionTest {

    private RegexConversionService service;

    @BeforeEach
    void setUp() {
        service = new RegexConversionService(new ConfigService(), new StandardPropertyResolver(),
                new StandardLiteralNormalizer());
    }

    @Test
    void caseInsensitiveRootUsesFlag() {
        ConversionResult result = service.convert(root(true, false, literal("ab")));

        assertEquals("ab", result.getPattern());
        assertEquals("gi", result.getFlags());
        assertFalse(result.hasWarnings());
    }

    @Test
    void localOptionFoldsLiterals() {
        // (?i:ab)c
        ConversionResult result = service.convert(root(options("i", "", literal("ab")), literal("c")));

        assertEquals("(?:[aA][bB])c", result.getPattern());
        assertEquals("g", result.getFlags());
    }

    @Test
    void localOptionLeavesNonLettersAndEscapesAlone() {
        ConversionResult result = service.convert(root(options("i", "", literal("1-"), literal("\\x41"))));

        assertEquals("(?:1-\\x41)", result.getPattern());
    }

    @Test
    void localOptionFoldsSetMembersAndRanges() {
        // (?i:[ac-f0-9])
        RootNode root = root(options("i", "", set(literal("a"), range("c", "f"), range("0", "9"))));

        assertEquals("(?:[aAc-fC-F0-9])", service.convert(root).getPattern());
    }

    @Test
    void annotatedSiblingsAfterOptionSwitchAreFolded() {
        // a(?i)k
        RootNode root = root(literal("a"), optionsSwitch("i", ""), caseInsensitive(literal("k"), true));

        assertEquals("a[kK]", service.convert(root).getPattern());
    }

    @Test
    void rangeThatCannotBeSwappedIsKeptWithWarning() {
        // (?i:[A-z]) spans non-letters between the cases
        ConversionResult result = service.convert(root(options("i", "", set(range("A", "z")))));

        assertEquals("(?:[A-z])", result.getPattern());
        assertEquals(1, result.getWarnings().size());
        assertEquals(WarningCategory.NESTED_CASE_INSENSITIVE_RANGE, result.getWarnings().get(0).getCategory());
    }

    @Test
    void localCaseSensitivityInCaseInsensitivePatternWarns() {
        // /(?-i:a)1/i
        ConversionResult result = service.convert(root(true, false, options("", "i", literal("a")), literal("1")));

        assertEquals("(?:a)1", result.getPattern());
        assertEquals("gi", result.getFlags());
        assertEquals(1, result.getWarnings().size());
        assertEquals(WarningCategory.NESTED_CASE_SENSITIVE, result.getWarnings().get(0).getCategory());
    }

    @Test
    void localCaseSensitiveSetMemberWarns() {
        ConversionResult result = service.convert(root(true, false, options("", "i", set(literal("b"), literal("2")))));

        assertEquals("(?:[b2])", result.getPattern());
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).getMessage().contains("set member 'b'"));
    }

    @Test
    void caseScopeEndsWithItsSubtree() {
        // (?i:a)a
        assertEquals("(?:[aA])a", service.convert(root(options("i", "", literal("a")), literal("a"))).getPattern());
    }
}
