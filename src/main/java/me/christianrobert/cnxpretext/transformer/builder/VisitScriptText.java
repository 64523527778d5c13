package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.builder.math.SymbolRole;
import me.christianrobert.cnxpretext.transformer.builder.math.SymbolTable;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;
import me.christianrobert.cnxpretext.transformer.util.PretextEscaper;

/**
 * Text-level {@code sup} and {@code sub}: PreTeXt has no such markup, so they become
 * math scripts ({@code cm<sup>2</sup>} renders as {@code cm<m>^{2}</m>}).
 */
public class VisitScriptText {

  public static String sup(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    return script("^", node);
  }

  public static String sub(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    return script("_", node);
  }

  private static String script(String marker, SourceNode node) {
    String latex = SymbolTable.translate(node.flattenText(), SymbolRole.DEFAULT);
    if (latex.isEmpty()) {
      return "";
    }
    return "<m>" + marker + "{" + PretextEscaper.escapeText(latex) + "}</m>";
  }
}
