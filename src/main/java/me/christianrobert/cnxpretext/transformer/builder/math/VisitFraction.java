package me.christianrobert.cnxpretext.transformer.builder.math;

import me.christianrobert.cnxpretext.transformer.model.SourceNode;

import java.util.List;

public class VisitFraction {
  public static String v(SourceNode node, SymbolRole role, LatexMathBuilder b) {

    // Grammar: mfrac numerator denominator
    // A missing denominator renders as \frac{n}{} rather than failing
    List<String> ops = b.operands(node, SymbolRole.DEFAULT);
    String numerator = ops.get(0);
    String denominator = ops.get(1);

    // linethickness="0" is how MathML writes a binomial coefficient
    if (isZeroThickness(node.getAttribute("linethickness"))) {
      return "\\binom{" + numerator + "}{" + denominator + "}";
    }

    if ("true".equals(node.getAttribute("bevelled"))) {
      return "{" + numerator + "}/{" + denominator + "}";
    }

    return "\\frac{" + numerator + "}{" + denominator + "}";
  }

  private static boolean isZeroThickness(String thickness) {
    if (thickness == null) {
      return false;
    }
    String number = thickness.trim().replaceAll("[a-z%]+$", "");
    if (number.isEmpty()) {
      return false;
    }
    try {
      return Double.parseDouble(number) == 0.0;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
