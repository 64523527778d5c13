package me.christianrobert.cnxpretext.transformer.builder.math;

import me.christianrobert.cnxpretext.transformer.model.SourceNode;

import java.util.List;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Under/over constructs: mover, munder, munderover.
 *
 * <p>A single-token base is rewritten in {@link SymbolRole#LIMIT_BASE} so that Σ
 * becomes {@code \sum}. Accented bases and compound bases keep the default role.
 * The accent is selected from the literal text of the over/under child, not from
 * its rewritten form.</p>
 */
public class VisitUnderOver {

  private static final Map<String, String> OVER_ACCENTS = Map.ofEntries(
      entry("¯", "\\overline"),
      entry("‾", "\\overline"),
      entry("\u0305", "\\overline"),
      entry("―", "\\overline"),
      entry("—", "\\overline"),
      entry("−", "\\overline"),
      entry("-", "\\overline"),
      entry("_", "\\overline"),
      entry("^", "\\hat"),
      entry("ˆ", "\\hat"),
      entry("\u0302", "\\hat"),
      entry("~", "\\tilde"),
      entry("˜", "\\tilde"),
      entry("∼", "\\tilde"),
      entry("\u0303", "\\tilde"),
      entry("→", "\\vec"),
      entry("\u20D7", "\\vec"),
      entry("˙", "\\dot"),
      entry("\u0307", "\\dot"),
      entry(".", "\\dot"),
      entry("¨", "\\ddot"),
      entry("\u0308", "\\ddot"),
      entry("ˇ", "\\check"),
      entry("´", "\\acute"),
      entry("`", "\\grave"),
      entry("⏞", "\\overbrace")
  );

  private static final Map<String, String> UNDER_ACCENTS = Map.of(
      "_", "\\underline",
      "¯", "\\underline",
      "‾", "\\underline",
      "\u0332", "\\underline",
      "⏟", "\\underbrace"
  );

  public static String over(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    String accent = OVER_ACCENTS.get(literal(node, 1));
    List<String> ops = b.operands(node, accent != null ? SymbolRole.DEFAULT : baseRole(node));
    String base = ops.get(0);
    String over = ops.get(1);

    if (accent != null) {
      return accent + "{" + base + "}";
    }
    if (over.isEmpty()) {
      return base;
    }
    if (SymbolTable.isLimitOperator(base)) {
      return base + "^{" + over + "}";
    }
    return "\\overset{" + over + "}{" + base + "}";
  }

  public static String under(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    String accent = UNDER_ACCENTS.get(literal(node, 1));
    List<String> ops = b.operands(node, accent != null ? SymbolRole.DEFAULT : baseRole(node));
    String base = ops.get(0);
    String under = ops.get(1);

    if (accent != null) {
      return accent + "{" + base + "}";
    }
    if (under.isEmpty()) {
      return base;
    }
    if (SymbolTable.isLimitOperator(base)) {
      return base + "_{" + under + "}";
    }
    return "\\underset{" + under + "}{" + base + "}";
  }

  public static String underover(SourceNode node, SymbolRole role, LatexMathBuilder b) {

    // Grammar: munderover base underscript overscript
    List<String> ops = b.operands(node, baseRole(node));
    return ops.get(0) + "_{" + ops.get(1) + "}^{" + ops.get(2) + "}";
  }

  /**
   * {@link SymbolRole#LIMIT_BASE} for a token base, also when wrapped in single-child rows.
   */
  private static SymbolRole baseRole(SourceNode node) {
    SourceNode base = node.childAt(0).orElse(null);
    while (base != null && "mrow".equals(base.getLocalName()) && base.getChildren().size() == 1) {
      base = base.getChildren().get(0);
    }
    if (base == null || base.hasChildren()) {
      return SymbolRole.DEFAULT;
    }
    return SymbolRole.LIMIT_BASE;
  }

  /**
   * Literal (untranslated) text of the child at the given position.
   */
  private static String literal(SourceNode node, int index) {
    return node.childAt(index).map(child -> child.flattenText().trim()).orElse("");
  }
}
