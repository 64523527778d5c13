package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.context.NamespaceTable;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;

import java.util.Map;

public class VisitList {

  private static final Map<String, String> MARKERS = Map.of(
      "arabic", "1",
      "lower-alpha", "a",
      "upper-alpha", "A",
      "lower-roman", "i",
      "upper-roman", "I"
  );

  public static String v(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    String title = b.titleOf(node, ctx);
    if (title.isEmpty()) {
      return items(node, ctx, b);
    }

    // only the <list> wrapper can carry a title
    TransformationContext inner = ctx.indented();
    return ctx.indent() + PretextCodeBuilder.open("list", node.getAttribute("id")) + "\n"
        + inner.indent() + "<title>" + title + "</title>\n"
        + items(node, inner, b)
        + ctx.indent() + "</list>\n";
  }

  private static String items(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    boolean enumerated = "enumerated".equals(node.getAttribute("list-type", "bulleted").trim());
    String tag = enumerated ? "ol" : "ul";

    StringBuilder sb = new StringBuilder();
    sb.append(ctx.indent()).append("<").append(tag);
    if (enumerated) {
      String marker = MARKERS.get(node.getAttribute("number-style", "").trim());
      if (marker != null) {
        sb.append(" marker=\"").append(marker).append("\"");
      }
    }
    sb.append(">\n");

    TransformationContext itemCtx = ctx.indented();
    for (SourceNode item : node.findChildren(NamespaceTable.CONTENT, "item")) {
      String inner = b.renderInlineTrimmed(item, itemCtx);
      if (inner.isEmpty()) {
        sb.append(itemCtx.indent()).append("<li/>\n");
      } else {
        sb.append(itemCtx.indent()).append("<li>").append(inner).append("</li>\n");
      }
    }

    sb.append(ctx.indent()).append("</").append(tag).append(">\n");
    return sb.toString();
  }
}
