package me.christianrobert.cnxpretext.transformer.builder.math;

import me.christianrobert.cnxpretext.transformer.model.SourceNode;

import java.util.List;

/**
 * Sub- and superscripts: msub, msup, msubsup.
 */
public class VisitScript {

  public static String sub(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    List<String> ops = b.operands(node, SymbolRole.DEFAULT);
    return base(ops.get(0)) + "_{" + ops.get(1) + "}";
  }

  public static String sup(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    List<String> ops = b.operands(node, SymbolRole.DEFAULT);
    return base(ops.get(0)) + "^{" + ops.get(1) + "}";
  }

  public static String subsup(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    List<String> ops = b.operands(node, SymbolRole.DEFAULT);
    return base(ops.get(0)) + "_{" + ops.get(1) + "}^{" + ops.get(2) + "}";
  }

  /**
   * A script needs something to attach to; an empty base becomes an empty group.
   */
  private static String base(String base) {
    return base.isEmpty() ? "{}" : base;
  }
}
