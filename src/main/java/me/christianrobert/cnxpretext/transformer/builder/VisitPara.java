package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.context.NamespaceTable;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Paragraphs. A table embedded in running text splits the paragraph:
 * {@code <p>before</p>}, the table, {@code <p>after</p>}. Paragraphs that
 * render to nothing are dropped.
 */
public class VisitPara {

  public static String v(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    int tables = node.findChildren(NamespaceTable.CONTENT, "table").size();
    if (tables == 0) {
      return paragraph(node, node.getAttribute("id"), ctx, b);
    }

    StringBuilder sb = new StringBuilder();
    List<SourceNode> run = new ArrayList<>();
    String runText = node.getText();
    String runId = node.getAttribute("id");
    int tableIndex = 0;

    for (SourceNode child : node.getChildren()) {
      if (!child.is(NamespaceTable.CONTENT, "table")) {
        run.add(child);
        continue;
      }
      sb.append(paragraph(segment(node, runText, run), runId, ctx, b));
      tableIndex++;
      // the paragraph owns one position; several tables share it with a suffix
      String fallbackId = tables == 1
          ? ctx.synthesizeId("table")
          : ctx.synthesizeId("table") + "-" + tableIndex;
      sb.append(VisitTable.render(child.withTail(""), fallbackId, ctx, b));

      run = new ArrayList<>();
      runText = child.getTail();
      runId = null;
    }
    sb.append(paragraph(segment(node, runText, run), runId, ctx, b));
    return sb.toString();
  }

  private static SourceNode segment(SourceNode para, String text, List<SourceNode> children) {
    return new SourceNode(para.getNamespaceUri(), para.getLocalName(), Map.of(), text, children, "");
  }

  private static String paragraph(SourceNode node, String id, TransformationContext ctx, PretextCodeBuilder b) {
    String inner = b.renderInlineTrimmed(node, ctx);
    if (inner.isEmpty()) {
      return "";
    }
    return ctx.indent() + PretextCodeBuilder.open("p", id) + inner + "</p>\n";
  }
}
