package me.christianrobert.cnxpretext.transformer.builder.math;

import me.christianrobert.cnxpretext.transformer.model.SourceNode;

/**
 * Grouping elements that need more than plain concatenation.
 */
public class VisitRow {

  /**
   * semantics: only the presentation child is rendered, annotations are dropped.
   */
  public static String semantics(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    return node.childAt(0).map(child -> b.visit(child, role)).orElse("");
  }

  public static String skip(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    return "";
  }

  public static String phantom(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    return "\\phantom{" + b.concatChildren(node, role) + "}";
  }
}
