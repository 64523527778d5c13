package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.context.ConversionOptions;
import me.christianrobert.cnxpretext.transformer.context.NamespaceTable;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;
import me.christianrobert.cnxpretext.transformer.util.PretextEscaper;

import java.util.Optional;

/**
 * {@code <image>} emission, shared by figures and by media met outside a figure.
 */
public class VisitImage {

  /**
   * Emitter for a bare {@code media} or {@code image} element.
   */
  public static String block(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    if (node.is(NamespaceTable.CONTENT, "image")) {
      return render(node, null, ctx);
    }
    return node.findDescendant(NamespaceTable.CONTENT, "image")
        .map(image -> render(image, node, ctx))
        .orElse("");
  }

  /**
   * @param image the source {@code image}
   * @param media its {@code media} wrapper, may be null
   */
  static String render(SourceNode image, SourceNode media, TransformationContext ctx) {
    String src = image.getAttribute("src", "").trim();
    if (src.isEmpty()) {
      return "";
    }
    ConversionOptions options = ctx.getOptions();

    StringBuilder sb = new StringBuilder();
    sb.append(ctx.indent()).append("<image source=\"")
        .append(PretextEscaper.escapeAttribute(rewritePath(src, options))).append("\"");
    width(image.getAttribute("width"), options.getPixelsPerPercent())
        .ifPresent(w -> sb.append(" width=\"").append(w).append("\""));

    String alt = image.getAttribute("alt");
    if ((alt == null || alt.isBlank()) && media != null) {
      alt = media.getAttribute("alt");
    }
    if (alt == null || alt.isBlank()) {
      sb.append("/>\n");
      return sb.toString();
    }

    sb.append(">\n");
    sb.append(ctx.indented().indent()).append("<description>")
        .append(PretextEscaper.escapeText(PretextEscaper.collapseWhitespace(alt.trim())))
        .append("</description>\n");
    sb.append(ctx.indent()).append("</image>\n");
    return sb.toString();
  }

  /**
   * Replaces the first matching source media prefix with the target prefix.
   * Paths with none of the prefixes are kept.
   */
  static String rewritePath(String src, ConversionOptions options) {
    for (String prefix : options.getMediaPrefixes()) {
      if (!prefix.isEmpty() && src.startsWith(prefix)) {
        return options.getMediaTargetPrefix() + src.substring(prefix.length());
      }
    }
    return src;
  }

  /**
   * Percentage width: {@code NN%} is kept, pixels (with or without {@code px}) are
   * divided by the ratio and clamped to 1..100. Anything else yields no width.
   */
  static Optional<String> width(String raw, int pixelsPerPercent) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String value = raw.trim();
    if (value.endsWith("%")) {
      return Optional.of(value);
    }
    if (value.endsWith("px")) {
      value = value.substring(0, value.length() - 2).trim();
    }
    try {
      double pixels = Double.parseDouble(value);
      long percent = Math.round(pixels / pixelsPerPercent);
      percent = Math.max(1, Math.min(100, percent));
      return Optional.of(percent + "%");
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }
}
