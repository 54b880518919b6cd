package me.christianrobert.onig2js.transformer.builder.group;

import me.christianrobert.onig2js.transformer.builder.JsRegexBuilder;
import me.christianrobert.onig2js.transformer.context.ConversionContext;
import me.christianrobert.onig2js.transformer.context.WarningCategory;
import me.christianrobert.onig2js.transformer.node.GroupNode;

import java.util.function.Supplier;

/**
 * Emulates atomic groups, which the target lacks.
 *
 * <p>A lookahead never backtracks into its content once it has matched, so
 * capturing the content inside a lookahead and then consuming exactly that
 * capture via a backreference behaves atomically:</p>
 * <pre>
 * 1(?&gt;33|3)37  →  1(?=(33|3))\1(?:)37
 * </pre>
 *
 * <p>The trailing empty group separates the backreference from following digits.
 * The backreference number is the emitted index of the synthetic capture, which
 * counts every capturing group emitted before it, synthetic ones included.</p>
 *
 * <p>Inside the content of an emulation, a second level of the trick would shift
 * the outer backreference, so nested atomic groups degrade to passive groups.</p>
 */
public class AtomicGroupEmulator {

    public static String emulate(GroupNode node, JsRegexBuilder b) {
        return emulate(() -> b.visitSequence(node.getChildren()), b, true,
                "Converted nested atomic group into a passive group");
    }

    /**
     * Wraps content produced by {@code content} atomically.
     *
     * @param content Produces the converted content; called exactly once, after the
     *                synthetic capture has been registered
     * @param b Builder
     * @param groupWhenNested Whether to wrap the content in a passive group when nested
     * @param nestedMessage Warning issued when nested in another emulation
     */
    public static String emulate(Supplier<String> content, JsRegexBuilder b,
                                 boolean groupWhenNested, String nestedMessage) {
        ConversionContext context = b.getContext();

        if (context.isInAtomicEmulation()) {
            context.warn(WarningCategory.NESTED_ATOMIC_GROUP, nestedMessage);
            String inner = content.get();
            return groupWhenNested ? "(?:" + inner + ")" : inner;
        }

        int reference = context.openSyntheticCapture();
        String inner;
        context.enterAtomicEmulation();
        try {
            inner = content.get();
        } finally {
            context.exitAtomicEmulation();
        }
        return "(?=(" + inner + "))\\" + reference + "(?:)";
    }
}
