package me.christianrobert.onig2js.transformer.util;

import me.christianrobert.onig2js.transformer.node.GroupNode;
import me.christianrobert.onig2js.transformer.node.Node;
import me.christianrobert.onig2js.transformer.node.QuantifierNode;
import me.christianrobert.onig2js.transformer.node.RootNode;
import me.christianrobert.onig2js.transformer.node.SetNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Formats pattern trees into human-readable, indented text representation.
 *
 * <p>Useful for debugging how a pattern was parsed and which inline option
 * scopes apply where.</p>
 *
 * <p>Example output for {@code (?i:a)[b[c]]+}:</p>
 * <pre>
 * ROOT "(?i:a)[b[c]]+"
 *   GROUP OPTIONS [i] "(?i:a)"
 *     LITERAL "a"
 *   QUANTIFIER + "[b[c]]+"
 *     SET level=0 "[b[c]]"
 *       LITERAL "b"
 *       SET level=1 "[c]"
 *         LITERAL "c"
 * </pre>
 */
public class NodeTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  /**
   * Formats a pattern tree into human-readable text.
   *
   * @param node Root of the tree (usually a {@link RootNode})
   * @return Formatted string representation
   */
  public static String format(Node node) {
    if (node == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    // explicit stack, trees may be deeper than the call stack allows
    Deque<Map.Entry<Node, Integer>> pending = new ArrayDeque<>();
    pending.push(Map.entry(node, 0));
    while (!pending.isEmpty()) {
      Map.Entry<Node, Integer> next = pending.pop();
      formatNode(next.getKey(), next.getValue(), sb);
      List<Node> children = next.getKey().getChildren();
      for (int i = children.size() - 1; i >= 0; i--) {
        pending.push(Map.entry(children.get(i), next.getValue() + 1));
      }
    }
    return sb.toString();
  }

  private static void formatNode(Node node, int depth, StringBuilder sb) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }

    sb.append(node.getKind());
    appendDetails(node, sb);

    Boolean caseInsensitive = node.getCaseInsensitive();
    if (caseInsensitive != null && !(node instanceof RootNode)) {
      sb.append(caseInsensitive ? " [i]" : " [-i]");
    }

    sb.append(" \"").append(escapeAndTruncate(node.getText())).append("\"\n");
  }

  private static void appendDetails(Node node, StringBuilder sb) {
    switch (node.getKind()) {
      case ROOT -> {
        RootNode root = (RootNode) node;
        if (root.isCaseInsensitive() || root.isDotAll()) {
          sb.append(" [").append(root.isCaseInsensitive() ? "i" : "").append(root.isDotAll() ? "m" : "").append("]");
        }
      }
      case GROUP -> {
        GroupNode group = (GroupNode) node;
        sb.append(' ').append(group.getType());
        if (group.getCaptureIndex() != null) {
          sb.append(" #").append(group.getCaptureIndex());
        }
      }
      case SET -> sb.append(" level=").append(((SetNode) node).getNestingLevel());
      case QUANTIFIER -> {
        QuantifierNode quantifier = (QuantifierNode) node;
        sb.append(' ').append(quantifier.getQuantifierText()).append(quantifier.getMode().getSuffix());
      }
      default -> {
        // kind and text are enough
      }
    }
  }

  /**
   * Escapes and truncates text for display.
   */
  private static String escapeAndTruncate(String text) {
    if (text == null) {
      return "";
    }
    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");
    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }
    return text;
  }
}
