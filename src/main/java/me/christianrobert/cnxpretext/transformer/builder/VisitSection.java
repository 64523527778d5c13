package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;

/**
 * Nested sections. Depth 1 below the module section is a {@code <subsection>},
 * anything deeper a {@code <subsubsection>}. Nesting depth is not limited.
 */
public class VisitSection {

  public static String v(SourceNode node, TransformationContext ctx, PretextCodeBuilder b) {
    String id = node.getAttribute("id");
    if (id == null || id.isBlank()) {
      id = ctx.synthesizeId("section");
    }

    TransformationContext nested = ctx.nestedSection(id);
    String tag = tagFor(nested.getSectionDepth());

    return ctx.indent() + PretextCodeBuilder.open(tag, id) + "\n"
        + b.titleLine(node, nested, null)
        + b.visitChildren(node, nested, PretextCodeBuilder.HEADER_ELEMENTS)
        + ctx.indent() + "</" + tag + ">\n";
  }

  static String tagFor(int depth) {
    if (depth <= 0) {
      return "section";
    }
    return depth == 1 ? "subsection" : "subsubsection";
  }
}
