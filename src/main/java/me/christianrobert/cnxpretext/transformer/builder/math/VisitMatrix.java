package me.christianrobert.cnxpretext.transformer.builder.math;

import me.christianrobert.cnxpretext.transformer.model.SourceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * mtable: cells joined with {@code &}, rows with {@code \\}, wrapped in a matrix environment.
 */
public class VisitMatrix {

  private static final String COLUMN_SEPARATOR = " & ";
  private static final String ROW_SEPARATOR = " \\\\ ";

  public static String v(SourceNode node, SymbolRole role, LatexMathBuilder b) {
    return render(node, "matrix", b);
  }

  static String render(SourceNode table, String environment, LatexMathBuilder b) {
    List<String> rows = new ArrayList<>();
    for (SourceNode row : table.getChildren()) {
      String name = row.getLocalName();
      if ("mtr".equals(name) || "mlabeledtr".equals(name)) {
        rows.add(renderRow(row, "mlabeledtr".equals(name), b));
      } else {
        // a bare cell or expression directly under mtable forms a row of its own
        rows.add(b.visit(row, SymbolRole.DEFAULT));
      }
    }
    return "\\begin{" + environment + "}" + String.join(ROW_SEPARATOR, rows) + "\\end{" + environment + "}";
  }

  private static String renderRow(SourceNode row, boolean labeled, LatexMathBuilder b) {
    List<String> cells = new ArrayList<>();
    List<SourceNode> children = row.getChildren();
    // the first child of a labeled row is the equation label, not a cell
    for (int i = labeled ? 1 : 0; i < children.size(); i++) {
      SourceNode cell = children.get(i);
      if ("mtd".equals(cell.getLocalName())) {
        cells.add(b.concatChildren(cell, SymbolRole.DEFAULT));
      } else {
        cells.add(b.visit(cell, SymbolRole.DEFAULT));
      }
    }
    return String.join(COLUMN_SEPARATOR, cells);
  }
}
