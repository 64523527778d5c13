package me.christianrobert.cnxpretext.transformer.builder.math;

import me.christianrobert.cnxpretext.transformer.model.SourceNode;

/**
 * Token elements: identifiers, numbers, operators, text and spacing.
 */
public class VisitToken {

  public static String identifier(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    String latex = SymbolTable.translate(node.flattenText(), role);
    if (latex.isEmpty()) {
      return "";
    }
    String variant = node.getAttribute("mathvariant", "");
    switch (variant) {
      case "bold":
        return "\\mathbf{" + latex + "}";
      case "double-struck":
        return "\\mathbb{" + latex + "}";
      case "script":
        return "\\mathcal{" + latex + "}";
      default:
        return latex;
    }
  }

  public static String number(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    return SymbolTable.translate(node.flattenText(), SymbolRole.DEFAULT);
  }

  public static String operator(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    // Σ as an operator is a summation, as the base of a limit construct as well
    SymbolRole operatorRole = role == SymbolRole.LIMIT_BASE ? SymbolRole.LIMIT_BASE : SymbolRole.OPERATOR;
    return SymbolTable.translate(node.flattenText(), operatorRole);
  }

  public static String text(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    String content = node.flattenText().trim();
    if (content.isEmpty()) {
      return "";
    }
    return "\\text{" + escapeTextMode(content) + "}";
  }

  public static String stringLiteral(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    String content = node.flattenText().trim();
    return "\\text{\"" + escapeTextMode(content) + "\"}";
  }

  public static String space(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    return "\\ ";
  }

  private static String escapeTextMode(String content) {
    return content
        .replace("\\", "\\textbackslash ")
        .replace("{", "\\{")
        .replace("}", "\\}")
        .replace("%", "\\%")
        .replace("&", "\\&")
        .replace("#", "\\#")
        .replace("$", "\\$");
  }
}
