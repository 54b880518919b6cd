package me.christianrobert.onig2js.transformer.node;

/**
 * Closed set of node kinds produced by the Onigmo pattern parser.
 *
 * <p>The dispatcher switches over this enum exhaustively, so adding a kind
 * fails compilation until a conversion for it exists.</p>
 */
public enum NodeKind {
    ROOT,
    SEQUENCE,
    ALTERNATION,
    GROUP,
    SET,
    RANGE,
    INTERSECTION,
    LITERAL,
    PROPERTY,
    CHARACTER_TYPE,
    QUANTIFIER,
    ANCHOR,
    BACKREFERENCE,
    UNKNOWN
}
