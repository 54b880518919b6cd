package me.christianrobert.onig2js.transformer.leaf;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StandardLiteralNormalizerTest {

    private StandardLiteralNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new StandardLiteralNormalizer();
    }

    @Test
    void plainTextPassesThrough() {
        assertEquals("abc", normalizer.normalize("abc"));
        assertEquals("\\.\\*", normalizer.normalize("\\.\\*"));
    }

    @Test
    void literalLineTerminatorsBecomeEscapes() {
        assertEquals("a\\nb\\r", normalizer.normalize("a\nb\r"));
        assertEquals("\\u2028\\u2029", normalizer.normalize(new String(new char[]{0x2028, 0x2029})));
    }

    @Test
    void bellAndEscapeBecomeHexEscapes() {
        assertEquals("\\x1B\\x07", normalizer.normalize("\\e\\a"));
    }

    @Test
    void bracedEscapesBecomeFourDigitEscapes() {
        assertEquals("\\u0041", normalizer.normalize("\\u{41}"));
        assertEquals("\\u00E9", normalizer.normalize("\\x{e9}"));
    }

    @Test
    void astralBracedEscapeBecomesSurrogatePair() {
        assertEquals("\\uD83D\\uDE00", normalizer.normalize("\\u{1F600}"));
    }

    @Test
    void controlEscapesAreUnified() {
        assertEquals("\\cA", normalizer.normalize("\\C-a"));
        assertEquals("\\cZ", normalizer.normalize("\\cz"));
    }

    @Test
    void backspaceIsPreserved() {
        assertEquals("\\b", normalizer.normalize("\\b"));
    }

    @Test
    void fixedWidthEscapesAreKept() {
        assertEquals("\\x41\\u00e9\\t", normalizer.normalize("\\x41\\u00e9\\t"));
    }

    @Test
    void nullIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> normalizer.normalize(null));
    }
}
