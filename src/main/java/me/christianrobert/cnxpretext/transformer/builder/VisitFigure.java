package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.context.NamespaceTable;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;

import java.util.List;

public class VisitFigure {

  public static String v(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    String id = node.getAttribute("id");
    if (id == null || id.isBlank()) {
      id = ctx.synthesizeId("figure");
    }
    return figure(node, id, ctx, b);
  }

  private static String figure(SourceNode node, String id, TransformationContext ctx, PretextCodeBuilder b) {
    TransformationContext inner = ctx.indented();
    StringBuilder sb = new StringBuilder();
    sb.append(ctx.indent()).append(PretextCodeBuilder.open("figure", id)).append("\n");

    String caption = node.findChild(NamespaceTable.CONTENT, "caption")
        .map(c -> b.renderInlineTrimmed(c, inner))
        .orElse("");
    if (caption.isEmpty()) {
      caption = b.titleOf(node, inner);
    }
    if (!caption.isEmpty()) {
      sb.append(inner.indent()).append("<caption>").append(caption).append("</caption>\n");
    }

    sb.append(image(node, inner));

    List<SourceNode> subfigures = node.findChildren(NamespaceTable.CONTENT, "subfigure");
    if (!subfigures.isEmpty()) {
      TransformationContext sub = inner.indented();
      sb.append(inner.indent()).append("<sidebyside>\n");
      for (int i = 0; i < subfigures.size(); i++) {
        SourceNode subfigure = subfigures.get(i);
        String subId = subfigure.getAttribute("id");
        if (subId == null || subId.isBlank()) {
          subId = id + "-" + (char) ('a' + Math.min(i, 25));
        }
        sb.append(figure(subfigure, subId, sub, b));
      }
      sb.append(inner.indent()).append("</sidebyside>\n");
    }

    sb.append(ctx.indent()).append("</figure>\n");
    return sb.toString();
  }

  /**
   * The figure's own image: a direct {@code image}, or the first one under a direct
   * {@code media}. Images of subfigures are not the figure's.
   */
  private static String image(SourceNode node, TransformationContext ctx) {
    for (SourceNode child : node.getChildren()) {
      if (child.is(NamespaceTable.CONTENT, "image")) {
        return VisitImage.render(child, null, ctx);
      }
      if (child.is(NamespaceTable.CONTENT, "media")) {
        return child.findDescendant(NamespaceTable.CONTENT, "image")
            .map(image -> VisitImage.render(image, child, ctx))
            .orElse("");
      }
    }
    return "";
  }
}
