package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.context.NamespaceTable;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;
import me.christianrobert.cnxpretext.transformer.util.PretextEscaper;

import java.util.Optional;

/**
 * Math placement. Display equations become {@code <men>} when the source gives them an
 * id (so they can be referenced) and {@code <me>} otherwise; inline math becomes
 * {@code <m>}. LaTeX is XML-escaped on the way out.
 */
public class VisitEquation {

  public static String v(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    Optional<SourceNode> math = node.findDescendant(NamespaceTable.MATH, "math");
    if (math.isEmpty()) {
      // an equation written as plain text
      String text = b.renderInlineTrimmed(node, ctx);
      if (text.isEmpty()) {
        return "";
      }
      return ctx.indent() + PretextCodeBuilder.open("p", node.getAttribute("id")) + text + "</p>\n";
    }
    return fromMath(math.get(), node.getAttribute("id"), ctx, b);
  }

  static String fromMath(SourceNode math, String id, TransformationContext ctx, PretextCodeBuilder b) {
    String latex = b.renderMath(math).trim();
    if (latex.isEmpty()) {
      return "";
    }
    String tag = id != null && !id.isBlank() ? "men" : "me";
    return ctx.indent() + "<p>" + PretextCodeBuilder.open(tag, id) + PretextEscaper.escapeText(latex)
        + "</" + tag + "></p>\n";
  }

  /**
   * {@code m:math} met in running text.
   */
  static String inlineMath(SourceNode math, PretextCodeBuilder b) {
    String latex = b.renderMath(math).trim();
    if (latex.isEmpty()) {
      return "";
    }
    String tag = "block".equals(math.getAttribute("display")) ? "me" : "m";
    return "<" + tag + ">" + PretextEscaper.escapeText(latex) + "</" + tag + ">";
  }

  /**
   * An {@code equation} element nested in running text.
   */
  static String inlineDisplay(SourceNode equation, PretextCodeBuilder b) {
    return equation.findDescendant(NamespaceTable.MATH, "math")
        .map(m -> {
          String latex = b.renderMath(m).trim();
          return latex.isEmpty() ? "" : "<me>" + PretextEscaper.escapeText(latex) + "</me>";
        })
        .orElse("");
  }
}
