package me.christianrobert.onig2js.transformer.builder;

import me.christianrobert.onig2js.transformer.context.WarningCategory;
import me.christianrobert.onig2js.transformer.node.PropertyNode;

/**
 * Converts a property outside of any set into a bracket expression, e.g.
 * {@code \p{ascii}} → {@code [\x00-\x7F]} and {@code \P{ascii}} → {@code [^\x00-\x7F]}.
 * Properties inside sets are handled by {@link VisitSet}.
 */
public class VisitProperty {

    public static String v(PropertyNode node, JsRegexBuilder b) {
        String ranges = b.getPropertyResolver().resolve(node.getName());
        if (ranges == null) {
            b.getContext().warnOfUnsupported(WarningCategory.UNSUPPORTED_PROPERTY,
                    "property '" + node.getName() + "'");
            return "";
        }
        return "[" + (node.isNegated() ? "^" : "") + ranges + "]";
    }
}
