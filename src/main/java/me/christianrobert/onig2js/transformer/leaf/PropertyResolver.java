package me.christianrobert.onig2js.transformer.leaf;

/**
 * Resolves property names (POSIX classes, Unicode categories, scripts, blocks and
 * their abbreviations) to literal character ranges usable inside a bracket expression.
 */
public interface PropertyResolver {

    /**
     * @param name Property name as written, e.g. {@code ascii}, {@code Lu}, {@code Greek}
     * @return Range text without brackets, e.g. {@code \x00-\x7F}, or null if unsupported
     */
    String resolve(String name);
}
