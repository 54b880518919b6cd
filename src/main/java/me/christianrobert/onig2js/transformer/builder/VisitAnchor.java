package me.christianrobert.onig2js.transformer.builder;

import me.christianrobert.onig2js.transformer.context.WarningCategory;
import me.christianrobert.onig2js.transformer.node.AnchorNode;

public class VisitAnchor {

    public static String v(AnchorNode node, JsRegexBuilder b) {
        return switch (node.getAnchorKind()) {
            case LINE_START, STRING_START -> "^";
            case LINE_END, STRING_END -> "$";
            case STRING_END_BEFORE_NEWLINE -> "(?=\\n?$)";
            case WORD_BOUNDARY -> "\\b";
            case NONWORD_BOUNDARY -> "\\B";
            case MATCH_START -> {
                b.getContext().warnOfUnsupported(WarningCategory.UNSUPPORTED_ANCHOR, "match start anchor '\\G'");
                yield "";
            }
        };
    }
}
