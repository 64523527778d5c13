package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.context.NamespaceTable;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;

import java.util.List;
import java.util.Set;

/**
 * Exercises: {@code problem} becomes {@code <statement>}, {@code commentary} a
 * {@code <hint>}, each {@code solution} a {@code <solution>}. An exercise without a
 * problem element uses its remaining children as the statement.
 */
public class VisitExercise {

  private static final Set<String> NOT_STATEMENT =
      Set.of("title", "label", "caption", "problem", "solution", "commentary");

  public static String v(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    return render(node, ctx, b, "");
  }

  /**
   * @param fallbackTitle rendered title markup used when the exercise has no title, may be empty
   */
  static String render(SourceNode node, TransformationContext ctx, PretextCodeBuilder b, String fallbackTitle) {
    TransformationContext inner = PretextCodeBuilder.childScope(node, "exercise", ctx).indented();
    TransformationContext body = inner.indented();
    StringBuilder sb = new StringBuilder();
    sb.append(ctx.indent()).append(PretextCodeBuilder.open("exercise", node.getAttribute("id"))).append("\n");

    String title = b.titleOf(node, inner);
    if (title.isEmpty()) {
      title = fallbackTitle;
    }
    if (!title.isEmpty()) {
      sb.append(inner.indent()).append("<title>").append(title).append("</title>\n");
    }

    String statement = node.findChild(NamespaceTable.CONTENT, "problem")
        .map(problem -> b.visitChildren(problem, body, PretextCodeBuilder.HEADER_ELEMENTS))
        .orElseGet(() -> b.visitChildren(node, body, NOT_STATEMENT));
    sb.append(container("statement", statement, inner));

    StringBuilder hints = new StringBuilder();
    StringBuilder solutions = new StringBuilder();
    List<SourceNode> children = node.getChildren();
    for (int i = 0; i < children.size(); i++) {
      SourceNode child = children.get(i);
      if (child.is(NamespaceTable.CONTENT, "commentary")) {
        hints.append(part("hint", child, body.atPosition(i), inner, b));
      } else if (child.is(NamespaceTable.CONTENT, "solution")) {
        solutions.append(part("solution", child, body.atPosition(i), inner, b));
      }
    }
    sb.append(hints).append(solutions);

    sb.append(ctx.indent()).append("</exercise>\n");
    return sb.toString();
  }

  /**
   * A hint or solution. Its children are numbered within the part itself.
   */
  static String part(String tag, SourceNode node, TransformationContext at, TransformationContext outer,
                     PretextCodeBuilder b) {
    TransformationContext scope = PretextCodeBuilder.childScope(node, tag, at);
    return container(tag, b.visitChildren(node, scope, PretextCodeBuilder.HEADER_ELEMENTS), outer);
  }

  static String container(String tag, String body, TransformationContext ctx) {
    if (body.isEmpty()) {
      return ctx.indent() + "<" + tag + "/>\n";
    }
    return ctx.indent() + "<" + tag + ">\n" + body + ctx.indent() + "</" + tag + ">\n";
  }

}
