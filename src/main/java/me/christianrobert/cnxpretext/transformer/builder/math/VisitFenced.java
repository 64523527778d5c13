package me.christianrobert.cnxpretext.transformer.builder.math;

import me.christianrobert.cnxpretext.transformer.model.SourceNode;

import java.util.List;
import java.util.Map;

/**
 * mfenced: delimiters from the open/close attributes, children joined by separators.
 */
public class VisitFenced {

  private static final Map<String, String> MATRIX_ENVIRONMENTS = Map.of(
      "(", "pmatrix",
      "[", "bmatrix",
      "{", "Bmatrix",
      "|", "vmatrix",
      "‖", "Vmatrix"
  );

  public static String v(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    String open = node.getAttribute("open", "(").trim();
    String close = node.getAttribute("close", ")").trim();

    // A fenced table is a matrix with its own delimiters
    List<SourceNode> children = node.getChildren();
    if (children.size() == 1 && "mtable".equals(children.get(0).getLocalName())
        && MATRIX_ENVIRONMENTS.containsKey(open)) {
      return VisitMatrix.render(children.get(0), MATRIX_ENVIRONMENTS.get(open), b);
    }

    String separators = node.getAttribute("separators", ",").replaceAll("\\s+", "");

    StringBuilder sb = new StringBuilder();
    LatexMathBuilder.appendPart(sb, DelimiterTable.toLatex(open));
    for (int i = 0; i < children.size(); i++) {
      if (i > 0 && !separators.isEmpty()) {
        int sepIndex = Math.min(i - 1, separators.length() - 1);
        String separator = String.valueOf(separators.charAt(sepIndex));
        LatexMathBuilder.appendPart(sb, SymbolTable.translate(separator, SymbolRole.OPERATOR));
      }
      LatexMathBuilder.appendPart(sb, b.visitWithTail(children.get(i), SymbolRole.DEFAULT));
    }
    LatexMathBuilder.appendPart(sb, DelimiterTable.toLatex(close));
    return sb.toString();
  }
}
