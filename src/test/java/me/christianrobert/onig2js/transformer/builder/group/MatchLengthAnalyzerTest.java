package me.christianrobert.onig2js.transformer.builder.group;

import me.christianrobert.onig2js.transformer.node.AnchorKind;
import me.christianrobert.onig2js.transformer.node.CharacterType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.onig2js.transformer.node.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class MatchLengthAnalyzerTest {

    @Test
    void literalsCountCodeUnits() {
        assertEquals(MatchLength.fixed(3), MatchLengthAnalyzer.analyze(literal("abc")));
        assertEquals(MatchLength.fixed(1), MatchLengthAnalyzer.analyze(literal("\\x41")));
        assertEquals(MatchLength.fixed(2), MatchLengthAnalyzer.analyze(literal("😀")));
        assertEquals(MatchLength.fixed(2), MatchLengthAnalyzer.analyze(literal("\\u{1F600}")));
    }

    @Test
    void sequencesAddUp() {
        assertEquals(MatchLength.fixed(4),
                MatchLengthAnalyzer.analyze(List.of(literal("ab"), set(range("0", "9")), property("ascii"))));
    }

    @Test
    void zeroWidthConstructsCountNothing() {
        assertEquals(MatchLength.fixed(1), MatchLengthAnalyzer.analyze(List.of(
                anchor(AnchorKind.WORD_BOUNDARY), lookahead(literal("xyz")), comment("c"), literal("a"))));
    }

    @Test
    void boundedQuantifiersMultiply() {
        assertEquals(MatchLength.of(2, 6), MatchLengthAnalyzer.analyze(quantifier(literal("ab"), 1, 3)));
        assertEquals(MatchLength.of(0, 1), MatchLengthAnalyzer.analyze(optional(literal("a"))));
    }

    @Test
    void unboundedQuantifierIsVariable() {
        assertTrue(MatchLengthAnalyzer.analyze(plus(literal("a"))).isVariable());
        assertTrue(MatchLengthAnalyzer.analyze(List.of(literal("a"), star(literal("b")))).isVariable());
    }

    @Test
    void alternationNeedsEqualBranches() {
        assertEquals(MatchLength.fixed(2), MatchLengthAnalyzer.analyze(alternation("ab", "cd")));
        assertTrue(MatchLengthAnalyzer.analyze(alternation("ab", "c")).isVariable());
    }

    @Test
    void groupsAreTransparent() {
        assertEquals(MatchLength.fixed(2), MatchLengthAnalyzer.analyze(capture(1, passive(literal("ab")))));
    }

    @Test
    void unanalyzableNodesAreVariable() {
        assertTrue(MatchLengthAnalyzer.analyze(backreference(1)).isVariable());
        assertTrue(MatchLengthAnalyzer.analyze(type(CharacterType.EXTENDED_GRAPHEME)).isVariable());
        assertTrue(MatchLengthAnalyzer.analyze(unknown("\\K")).isVariable());
    }

    @Test
    void linebreakMatchesOneOrTwoUnits() {
        assertEquals(MatchLength.of(1, 2), MatchLengthAnalyzer.analyze(type(CharacterType.LINEBREAK)));
    }

    @Test
    void hugeRepetitionIsVariable() {
        assertTrue(MatchLengthAnalyzer.analyze(quantifier(quantifier(literal("a"), 100000, 100000), 100000, 100000))
                .isVariable());
    }
}
