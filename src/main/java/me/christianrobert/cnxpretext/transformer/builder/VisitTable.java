package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.context.NamespaceTable;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;

/**
 * Tables. Header rows are marked {@code header="yes"}; body and footer rows are plain.
 *
 * <p>The declared {@code cols} count is not checked against the rows: ragged rows
 * are written as they come.</p>
 */
public class VisitTable {

  public static String v(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    return render(node, ctx.synthesizeId("table"), ctx, b);
  }

  /**
   * @param fallbackId identifier used when the table has no source id
   */
  static String render(SourceNode node, String fallbackId, TransformationContext ctx, PretextCodeBuilder b) {
    String id = node.getAttribute("id");
    if (id == null || id.isBlank()) {
      id = fallbackId;
    }

    TransformationContext inner = ctx.indented();
    StringBuilder sb = new StringBuilder();
    sb.append(ctx.indent()).append(PretextCodeBuilder.open("table", id)).append("\n");

    String title = b.titleOf(node, inner);
    if (title.isEmpty()) {
      title = node.findChild(NamespaceTable.CONTENT, "caption")
          .map(c -> b.renderInlineTrimmed(c, inner))
          .orElse("");
    }
    if (!title.isEmpty()) {
      sb.append(inner.indent()).append("<title>").append(title).append("</title>\n");
    }

    sb.append(inner.indent()).append("<tabular>\n");
    TransformationContext rowCtx = inner.indented();
    for (SourceNode group : node.findChildren(NamespaceTable.CONTENT, "tgroup")) {
      group.findChild(NamespaceTable.CONTENT, "thead")
          .ifPresent(head -> rows(head, true, rowCtx, b, sb));
      group.findChild(NamespaceTable.CONTENT, "tbody")
          .ifPresent(body -> rows(body, false, rowCtx, b, sb));
      group.findChild(NamespaceTable.CONTENT, "tfoot")
          .ifPresent(foot -> rows(foot, false, rowCtx, b, sb));
    }
    sb.append(inner.indent()).append("</tabular>\n");

    sb.append(ctx.indent()).append("</table>\n");
    return sb.toString();
  }

  private static void rows(SourceNode group, boolean header, TransformationContext ctx,
                           PretextCodeBuilder b, StringBuilder sb) {
    for (SourceNode row : group.findChildren(NamespaceTable.CONTENT, "row")) {
      sb.append(ctx.indent()).append(header ? "<row header=\"yes\">" : "<row>");
      for (SourceNode entry : row.findChildren(NamespaceTable.CONTENT, "entry")) {
        sb.append("<cell>").append(b.renderInlineTrimmed(entry, ctx)).append("</cell>");
      }
      sb.append("</row>\n");
    }
  }
}
