package me.christianrobert.cnxpretext.transformer.util;

import me.christianrobert.cnxpretext.transformer.context.ElementClassifier;
import me.christianrobert.cnxpretext.transformer.context.NamespaceTable;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;

import java.util.Map;

/**
 * Formats a CNXML source tree into an indented, human-readable text dump.
 *
 * <p>Useful for seeing how mixed content was split into leading text and tails,
 * and how each element was classified.</p>
 *
 * <p>Example output:</p>
 * <pre>
 * para [BLOCK_CONTAINER] id=p1 "See "
 *   emphasis [INLINE_SPAN] effect=bold "this"
 *     ~ " now."
 * </pre>
 */
public class SourceTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  /**
   * Formats a source tree into human-readable text.
   *
   * @param tree Root of the source tree
   * @return Formatted string representation
   */
  public static String format(SourceNode tree) {
    if (tree == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(tree, 0, sb);
    return sb.toString();
  }

  private static void formatNode(SourceNode node, int depth, StringBuilder sb) {
    indent(depth, sb);

    sb.append(prefix(node.getNamespaceUri())).append(node.getLocalName());
    sb.append(" [").append(ElementClassifier.classify(node)).append("]");

    for (Map.Entry<String, String> attr : node.getAttributes().entrySet()) {
      sb.append(" ").append(attr.getKey()).append("=").append(escapeAndTruncate(attr.getValue()));
    }

    if (!node.getText().isBlank()) {
      sb.append(" \"").append(escapeAndTruncate(node.getText())).append("\"");
    }
    sb.append("\n");

    for (SourceNode child : node.getChildren()) {
      formatNode(child, depth + 1, sb);
      if (!child.getTail().isBlank()) {
        indent(depth + 2, sb);
        sb.append("~ \"").append(escapeAndTruncate(child.getTail())).append("\"\n");
      }
    }
  }

  private static String prefix(String namespaceUri) {
    if (NamespaceTable.isMath(namespaceUri)) {
      return "m:";
    }
    if (NamespaceTable.isMetadata(namespaceUri)) {
      return "md:";
    }
    return "";
  }

  private static void indent(int depth, StringBuilder sb) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }
  }

  /**
   * Escapes newlines and truncates long text for single-line display.
   */
  private static String escapeAndTruncate(String text) {
    String escaped = text.replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t");
    if (escaped.length() > MAX_TEXT_LENGTH) {
      return escaped.substring(0, MAX_TEXT_LENGTH - 3) + "...";
    }
    return escaped;
  }
}
