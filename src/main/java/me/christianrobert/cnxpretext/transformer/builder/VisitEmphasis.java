package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.builder.math.SymbolRole;
import me.christianrobert.cnxpretext.transformer.builder.math.SymbolTable;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;
import me.christianrobert.cnxpretext.transformer.util.PretextEscaper;

import java.util.Set;

public class VisitEmphasis {

  private static final Set<String> BOLD = Set.of("bold", "strong");
  private static final Set<String> ITALIC = Set.of("italics", "italic");

  public static String v(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    // CNXML renders emphasis without an effect as bold
    String effect = node.getAttribute("effect", "bold").trim().toLowerCase();

    if (BOLD.contains(effect)) {
      return VisitInlineContent.wrap("term", node, ctx, b);
    }

    if (ITALIC.contains(effect)) {
      String flat = node.flattenText().trim();
      if (isVariable(flat, ctx)) {
        // italic single letters in textbook prose are math variables
        return "<m>" + PretextEscaper.escapeText(SymbolTable.translate(flat, SymbolRole.DEFAULT)) + "</m>";
      }
      return VisitInlineContent.wrap("em", node, ctx, b);
    }

    if ("underline".equals(effect)) {
      return VisitInlineContent.wrap("em", node, ctx, b);
    }

    // smallcaps, normal and unknown effects
    return b.renderInline(node, ctx);
  }

  static boolean isVariable(String flat, TransformationContext ctx) {
    if (flat.isEmpty()) {
      return false;
    }
    if (flat.codePointCount(0, flat.length()) == 1) {
      return Character.isLetterOrDigit(flat.codePointAt(0));
    }
    return ctx.getOptions().getVariableNames().contains(flat);
  }
}
