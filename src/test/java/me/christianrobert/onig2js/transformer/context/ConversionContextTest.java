package me.christianrobert.onig2js.transformer.context;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConversionContextTest {

    private ConversionContext context;

    @BeforeEach
    void setUp() {
        context = new ConversionContext(ConversionOptions.defaults(), false, false);
    }

    @Test
    void contextCannotBeStartedTwice() {
        context.start();

        assertThrows(MalformedTreeException.class, () -> context.start());
    }

    @Test
    void completedContextRefusesNodes() {
        context.start();
        context.complete();

        assertTrue(context.isCompleted());
        assertThrows(MalformedTreeException.class, () -> context.enterNode(() -> "a"));
    }

    @Test
    void depthIsBounded() {
        ConversionContext shallow = new ConversionContext(ConversionOptions.defaults().withMaxNestingDepth(2), false, false);
        shallow.enterNode(() -> "a");
        shallow.enterNode(() -> "b");

        NestingDepthExceededException e = assertThrows(NestingDepthExceededException.class, () -> shallow.enterNode(() -> "c"));
        assertEquals(2, e.getMaxDepth());
        assertEquals("c", e.getSource());
    }

    @Test
    void exceededDepthAbbreviatesLongSource() {
        ConversionContext shallow = new ConversionContext(ConversionOptions.defaults().withMaxNestingDepth(1), false, false);
        shallow.enterNode(() -> "a");

        NestingDepthExceededException e = assertThrows(NestingDepthExceededException.class,
                () -> shallow.enterNode(() -> "x".repeat(1000)));
        assertEquals("x".repeat(200) + "...", e.getSource());
    }

    @Test
    void sourceIsNotRenderedWithinBound() {
        context.enterNode(() -> {
            throw new AssertionError("source rendered although the bound was not exceeded");
        });

        assertEquals(1, context.getDepth());
    }

    @Test
    void depthIsReleasedOnExit() {
        context.enterNode(() -> "a");
        context.enterNode(() -> "b");
        context.exitNode();

        assertEquals(1, context.getDepth());
    }

    @Test
    void capturesAreNumberedInEmissionOrder() {
        assertEquals(1, context.registerCapture(1, null));
        assertEquals(2, context.openSyntheticCapture());
        assertEquals(3, context.registerCapture(2, "name"));

        assertEquals(Integer.valueOf(1), context.resolveCapture(1));
        assertEquals(Integer.valueOf(3), context.resolveCapture(2));
        assertEquals(Integer.valueOf(3), context.resolveCapture("name"));
        assertNull(context.resolveCapture(3));
        assertNull(context.resolveCapture("other"));
        assertEquals(3, context.getCaptureCount());
    }

    @Test
    void setBuffersAreClearedOnEnd() {
        context.beginSet(true);
        context.bufferSetMember("a");
        context.bufferSetExtraction("[^b]");

        assertTrue(context.isInSet());
        assertTrue(context.isNegativeBaseSet());
        assertEquals(1, context.getBufferedSetMembers().size());
        assertEquals(1, context.getBufferedSetExtractions().size());

        context.endSet();

        assertFalse(context.isInSet());
        assertFalse(context.isNegativeBaseSet());
        assertTrue(context.getBufferedSetMembers().isEmpty());
        assertTrue(context.getBufferedSetExtractions().isEmpty());
    }

    @Test
    void enteringSetWithFilledBuffersIsMalformed() {
        context.bufferSetMember("leftover");

        assertThrows(MalformedTreeException.class, () -> context.beginSet(false));
    }

    @Test
    void enteringSetTwiceIsMalformed() {
        context.beginSet(false);

        assertThrows(MalformedTreeException.class, () -> context.beginSet(false));
    }

    @Test
    void caseScopesStack() {
        assertFalse(context.isCaseInsensitive());

        context.pushCaseScope(true);
        assertTrue(context.isCaseInsensitive());
        assertTrue(context.isLocallyCaseInsensitive());

        context.pushCaseScope(false);
        assertFalse(context.isCaseInsensitive());
        assertFalse(context.isLocallyCaseSensitive());

        context.popCaseScope();
        context.popCaseScope();
        assertFalse(context.isCaseInsensitive());
        assertThrows(IllegalStateException.class, () -> context.popCaseScope());
    }

    @Test
    void caseInsensitiveRootIsNotLocal() {
        ConversionContext insensitive = new ConversionContext(ConversionOptions.defaults(), true, false);
        insensitive.pushCaseScope(true);

        assertTrue(insensitive.isCaseInsensitive());
        assertFalse(insensitive.isLocallyCaseInsensitive());

        insensitive.pushCaseScope(false);
        assertTrue(insensitive.isLocallyCaseSensitive());
    }

    @Test
    void atomicEmulationNests() {
        assertFalse(context.isInAtomicEmulation());
        context.enterAtomicEmulation();
        context.enterAtomicEmulation();
        context.exitAtomicEmulation();
        assertTrue(context.isInAtomicEmulation());
        context.exitAtomicEmulation();
        assertFalse(context.isInAtomicEmulation());
    }

    @Test
    void warningsKeepOrder() {
        context.warnOfUnsupported(WarningCategory.SET_INTERSECTION, "set intersection");
        context.warn(WarningCategory.LOOKBEHIND, "Converted lookbehind");

        assertEquals(2, context.getWarnings().size());
        assertEquals("Dropped unsupported set intersection", context.getWarnings().get(0).getMessage());
        assertEquals("set-intersection: Dropped unsupported set intersection", context.getWarnings().get(0).toString());
        assertEquals(WarningCategory.LOOKBEHIND, context.getWarnings().get(1).getCategory());
    }
}
