package me.christianrobert.cnxpretext.transformer.builder.math;

import me.christianrobert.cnxpretext.transformer.model.SourceNode;

import java.util.List;

public class VisitRoot {

  /**
   * msqrt has an inferred row: all children form the single radicand.
   */
  public static String sqrt(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    return "\\sqrt{" + b.concatChildren(node, SymbolRole.DEFAULT) + "}";
  }

  /**
   * mroot base index, rendered as \sqrt[index]{base}.
   */
  public static String root(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    List<String> ops = b.operands(node, SymbolRole.DEFAULT);
    String base = ops.get(0);
    String index = ops.get(1);
    if (index.isEmpty()) {
      return "\\sqrt{" + base + "}";
    }
    return "\\sqrt[" + index + "]{" + base + "}";
  }
}
