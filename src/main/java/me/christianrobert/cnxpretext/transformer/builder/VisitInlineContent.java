package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.context.ElementClassification;
import me.christianrobert.cnxpretext.transformer.context.ElementClassifier;
import me.christianrobert.cnxpretext.transformer.context.RenderMode;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;
import me.christianrobert.cnxpretext.transformer.util.PretextEscaper;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Inline renderer: text, tails, inline spans and math of one node, in document order.
 *
 * <p>INLINE mode collapses whitespace runs in text to one space. BLOCK mode keeps
 * text verbatim. Text is escaped exactly once, here.</p>
 */
public class VisitInlineContent {

  static final int MAX_NEWLINES = 10;

  private static final Map<String, ElementVisitor> INLINE_DISPATCH = Map.ofEntries(
      entry("emphasis", VisitEmphasis::v),
      entry("term", (n, c, b) -> VisitInlineContent.wrap("term", n, c, b)),
      entry("quote", (n, c, b) -> VisitInlineContent.wrap("q", n, c, b)),
      entry("foreign", (n, c, b) -> VisitInlineContent.wrap("foreign", n, c, b)),
      entry("code", VisitInlineContent::code),
      entry("sup", VisitScriptText::sup),
      entry("sub", VisitScriptText::sub),
      entry("newline", VisitInlineContent::newline),
      entry("link", VisitLink::v)
  );

  public static String v(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    StringBuilder sb = new StringBuilder();
    sb.append(text(node.getText(), ctx));
    for (SourceNode child : node.getChildren()) {
      sb.append(child(child, ctx, b));
      sb.append(text(child.getTail(), ctx));
    }
    return sb.toString();
  }

  private static String child(SourceNode child, TransformationContext ctx, PretextCodeBuilder b) {
    ElementClassification classification = ElementClassifier.classify(child);
    switch (classification) {
      case LEAF_MATH:
        return VisitEquation.inlineMath(child, b);
      case INLINE_SPAN: {
        ElementVisitor visitor = INLINE_DISPATCH.get(child.getLocalName());
        if (visitor != null) {
          return visitor.v(child, ctx, b);
        }
        break;
      }
      case BLOCK_CONTAINER:
        switch (child.getLocalName()) {
          case "list":
            // nested list inside an item or paragraph
            return "\n" + VisitList.v(child, ctx.indented(), b) + ctx.indent();
          case "media":
          case "image":
            return "\n" + VisitImage.block(child, ctx.indented(), b) + ctx.indent();
          case "equation":
            return VisitEquation.inlineDisplay(child, b);
          case "para":
            // paragraphs inside items and cells keep their inline markup
            return " " + b.renderInline(child, ctx) + " ";
          default:
            break;
        }
        break;
      default:
        break;
    }
    // anything else keeps its words and loses its markup
    return text(child.flattenText(), ctx);
  }

  static String text(String raw, TransformationContext ctx) {
    if (raw == null || raw.isEmpty()) {
      return "";
    }
    String value = ctx.getMode() == RenderMode.INLINE ? PretextEscaper.collapseWhitespace(raw) : raw;
    return PretextEscaper.escapeText(value);
  }

  static String wrap(String tag, SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    String inner = b.renderInline(node, ctx);
    if (inner.isBlank()) {
      return inner;
    }
    return "<" + tag + ">" + inner + "</" + tag + ">";
  }

  private static String code(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    String inner = text(node.flattenText(), ctx);
    if (inner.isBlank()) {
      return inner;
    }
    return "<c>" + inner + "</c>";
  }

  private static String newline(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    int count = 1;
    try {
      count = Math.min(MAX_NEWLINES, Math.max(1, Integer.parseInt(node.getAttribute("count", "1").trim())));
    } catch (NumberFormatException e) {
      // malformed count renders a single break
    }
    return "<nbsp/>".repeat(count);
  }
}
