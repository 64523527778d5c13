package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.context.NamespaceTable;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;
import me.christianrobert.cnxpretext.transformer.util.PretextEscaper;

import java.util.List;

/**
 * Notes, mapped by class (see {@link NoteKind}). A try-it note holding exercises
 * becomes those exercises, titled "Try It"; without exercises the note body is the
 * statement of a single exercise.
 */
public class VisitNote {

  public static String v(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    NoteKind kind = NoteKind.of(node.getAttribute("class"));
    String id = node.getAttribute("id");

    if (kind == NoteKind.TRY) {
      return tryIt(node, id, ctx, b);
    }

    TransformationContext inner = PretextCodeBuilder.childScope(node, "note", ctx).indented();
    String body = b.visitChildren(node, inner, PretextCodeBuilder.HEADER_ELEMENTS);
    String title = b.titleLine(node, inner, kind.getDefaultTitle());
    if (body.isEmpty() && title.isEmpty()) {
      return "";
    }

    return ctx.indent() + PretextCodeBuilder.open(kind.getTag(), id) + "\n"
        + title
        + body
        + ctx.indent() + "</" + kind.getTag() + ">\n";
  }

  private static String tryIt(SourceNode node, String id, TransformationContext ctx, PretextCodeBuilder b) {
    List<SourceNode> exercises = node.findChildren(NamespaceTable.CONTENT, "exercise");
    String title = NoteKind.TRY.getDefaultTitle();
    TransformationContext scope = PretextCodeBuilder.childScope(node, "note", ctx);

    if (!exercises.isEmpty()) {
      String noteTitle = b.titleOf(node, ctx);
      String fallback = noteTitle.isEmpty() ? PretextEscaper.escapeText(title) : noteTitle;
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < node.getChildren().size(); i++) {
        SourceNode child = node.getChildren().get(i);
        if (child.is(NamespaceTable.CONTENT, "exercise")) {
          sb.append(VisitExercise.render(child, scope.atPosition(i), b, fallback));
        } else if (!PretextCodeBuilder.HEADER_ELEMENTS.contains(child.getLocalName())) {
          // lead-in text around the exercises
          sb.append(b.visitBlock(child, scope.atPosition(i)));
        }
      }
      return sb.toString();
    }

    TransformationContext inner = ctx.indented();
    String statement = b.visitChildren(node, scope.indented().indented(), PretextCodeBuilder.HEADER_ELEMENTS);
    if (statement.isEmpty()) {
      return "";
    }
    return ctx.indent() + PretextCodeBuilder.open("exercise", id) + "\n"
        + b.titleLine(node, inner, title)
        + inner.indent() + "<statement>\n"
        + statement
        + inner.indent() + "</statement>\n"
        + ctx.indent() + "</exercise>\n";
  }
}
