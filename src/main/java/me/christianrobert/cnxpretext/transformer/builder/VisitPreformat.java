package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.context.RenderMode;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;

/**
 * {@code preformat} and block {@code code}: text kept verbatim in a {@code <pre>}.
 */
public class VisitPreformat {

  public static String v(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    String text = VisitInlineContent.text(node.flattenText(), ctx.withMode(RenderMode.BLOCK));
    if (text.isBlank()) {
      return "";
    }
    return ctx.indent() + "<pre>" + stripBlankEdges(text) + "</pre>\n";
  }

  private static String stripBlankEdges(String text) {
    String result = text;
    while (result.startsWith("\n") || result.startsWith("\r")) {
      result = result.substring(1);
    }
    return result.stripTrailing();
  }
}
