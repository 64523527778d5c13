package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.context.NamespaceTable;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;

import java.util.List;

/**
 * Worked examples. CNXML nests the worked problem either directly ({@code problem},
 * {@code solution}) or inside an {@code exercise}; both forms flatten into one
 * {@code <statement>} followed by the solutions, in document order.
 */
public class VisitExample {

  public static String v(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    TransformationContext inner = PretextCodeBuilder.childScope(node, "example", ctx).indented();
    TransformationContext body = inner.indented();

    StringBuilder statement = new StringBuilder();
    StringBuilder solutions = new StringBuilder();
    List<SourceNode> children = node.getChildren();
    for (int i = 0; i < children.size(); i++) {
      SourceNode child = children.get(i);
      TransformationContext at = body.atPosition(i);
      if (!NamespaceTable.isContent(child.getNamespaceUri())) {
        statement.append(b.visitBlock(child, at));
        continue;
      }
      switch (child.getLocalName()) {
        case "title":
        case "label":
          break;
        case "solution":
          solutions.append(VisitExercise.part("solution", child, at, inner, b));
          break;
        case "problem":
          statement.append(b.visitChildren(child, PretextCodeBuilder.childScope(child, "problem", at),
              PretextCodeBuilder.HEADER_ELEMENTS));
          break;
        case "exercise":
          exercise(child, PretextCodeBuilder.childScope(child, "exercise", at), inner, b, statement, solutions);
          break;
        default:
          statement.append(b.visitBlock(child, at));
          break;
      }
    }

    StringBuilder sb = new StringBuilder();
    sb.append(ctx.indent()).append(PretextCodeBuilder.open("example", node.getAttribute("id"))).append("\n");
    sb.append(b.titleLine(node, inner, null));
    sb.append(VisitExercise.container("statement", statement.toString(), inner));
    sb.append(solutions);
    sb.append(ctx.indent()).append("</example>\n");
    return sb.toString();
  }

  /**
   * Flattens a nested exercise: its problem joins the statement, its solutions follow.
   */
  private static void exercise(SourceNode exercise, TransformationContext scope, TransformationContext inner,
                               PretextCodeBuilder b, StringBuilder statement, StringBuilder solutions) {
    List<SourceNode> children = exercise.getChildren();
    for (int i = 0; i < children.size(); i++) {
      SourceNode child = children.get(i);
      if (child.is(NamespaceTable.CONTENT, "problem")) {
        statement.append(b.visitChildren(child, scope, PretextCodeBuilder.HEADER_ELEMENTS));
      } else if (child.is(NamespaceTable.CONTENT, "solution")) {
        solutions.append(VisitExercise.part("solution", child, scope.atPosition(i), inner, b));
      }
    }
  }
}
