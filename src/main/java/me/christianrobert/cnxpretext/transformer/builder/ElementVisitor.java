package me.christianrobert.cnxpretext.transformer.builder;

import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;

/**
 * Emitter for one CNXML construct. Implementations are static {@code VisitX::v} helpers.
 */
@FunctionalInterface
public interface ElementVisitor {

  String v(SourceNode node, TransformationContext ctx, PretextCodeBuilder b);
}
