package me.christianrobert.onig2js.transformer.builder;

import me.christianrobert.onig2js.transformer.context.ConversionContext;
import me.christianrobert.onig2js.transformer.context.WarningCategory;
import me.christianrobert.onig2js.transformer.node.BackreferenceNode;

/**
 * Renumbers backreferences.
 *
 * <p>Group numbers shift when atomic groups are emulated with synthetic captures,
 * and names are stripped from named groups, so every reference is rewritten to the
 * emitted number of its group. Only groups emitted before the reference can be
 * resolved; forward references are dropped.</p>
 */
public class VisitBackreference {

    public static String v(BackreferenceNode node, JsRegexBuilder b) {
        ConversionContext context = b.getContext();
        Integer emitted = node.isNamed()
                ? context.resolveCapture(node.getName())
                : context.resolveCapture(node.getNumber());
        if (emitted == null) {
            context.warnOfUnsupported(WarningCategory.UNRESOLVED_BACKREFERENCE,
                    "unresolved backreference '" + node.getText() + "'");
            return "(?:)";
        }
        return "\\" + emitted;
    }
}
