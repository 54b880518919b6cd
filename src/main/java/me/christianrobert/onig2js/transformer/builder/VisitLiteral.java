package me.christianrobert.onig2js.transformer.builder;

import me.christianrobert.onig2js.transformer.leaf.CaseFolder;
import me.christianrobert.onig2js.transformer.node.LiteralNode;

public class VisitLiteral {

    public static String v(LiteralNode node, JsRegexBuilder b) {
        String normalized = b.getLiteralNormalizer().normalize(node.getText());
        return CaseFolder.foldLiteral(normalized, node.getText(), b.getContext());
    }
}
