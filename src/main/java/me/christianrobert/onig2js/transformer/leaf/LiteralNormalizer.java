package me.christianrobert.onig2js.transformer.leaf;

/**
 * Turns raw Onigmo literal text into text that is safe in the target dialect.
 * Implementations must be pure functions.
 */
public interface LiteralNormalizer {

    /**
     * @param raw Raw literal text, escapes included
     * @return Equivalent target-dialect text
     */
    String normalize(String raw);
}
