package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;
import me.christianrobert.cnxpretext.transformer.util.PretextEscaper;

public class VisitLink {

  public static String v(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    String inner = b.renderInline(node, ctx).trim();

    String url = node.getAttribute("url");
    if (url != null && !url.isBlank()) {
      return element("url", "href", url.trim(), inner);
    }

    String ref = reference(node.getAttribute("document"), node.getAttribute("target-id"));
    if (ref != null) {
      return element("xref", "ref", ref, inner);
    }

    // no target: keep the words
    return inner;
  }

  /**
   * {@code D-T}, {@code T} or {@code D}; null when the link has neither attribute.
   */
  static String reference(String document, String targetId) {
    boolean hasDocument = document != null && !document.isBlank();
    boolean hasTarget = targetId != null && !targetId.isBlank();
    if (hasDocument && hasTarget) {
      return document.trim() + "-" + targetId.trim();
    }
    if (hasTarget) {
      return targetId.trim();
    }
    if (hasDocument) {
      return document.trim();
    }
    return null;
  }

  private static String element(String tag, String attribute, String value, String inner) {
    String open = "<" + tag + " " + attribute + "=\"" + PretextEscaper.escapeAttribute(value) + "\"";
    if (inner.isEmpty()) {
      return open + "/>";
    }
    return open + ">" + inner + "</" + tag + ">";
  }
}
