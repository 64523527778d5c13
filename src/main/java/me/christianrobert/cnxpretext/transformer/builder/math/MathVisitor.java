package me.christianrobert.cnxpretext.transformer.builder.math;

import me.christianrobert.cnxpretext.transformer.model.SourceNode;

/**
 * Rewrites one MathML construct to LaTeX.
 */
@FunctionalInterface
public interface MathVisitor {
  String v(SourceNode node, SymbolRole role, LatexMathBuilder b);
}
