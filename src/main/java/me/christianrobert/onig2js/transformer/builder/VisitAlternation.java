package me.christianrobert.onig2js.transformer.builder;

import me.christianrobert.onig2js.transformer.node.AlternationNode;
import me.christianrobert.onig2js.transformer.node.Node;

import java.util.List;

public class VisitAlternation {

    public static String v(AlternationNode node, JsRegexBuilder b) {
        List<Node> branches = node.getBranches();
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < branches.size(); i++) {
            if (i > 0) {
                result.append('|');
            }
            result.append(b.visit(branches.get(i)));
        }
        return result.toString();
    }
}
