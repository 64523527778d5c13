package me.christianrobert.cnxpretext.transformer.context;

import me.christianrobert.cnxpretext.transformer.model.SourceNode;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Fixed lookup table from CNXML element name to its {@link ElementClassification}.
 *
 * <p>Adding a source tag means adding one entry here and, if the tag is
 * structurally new, one emitter in the builder's dispatch table.</p>
 */
public final class ElementClassifier {

    private static final Map<String, ElementClassification> CONTENT_ELEMENTS = Map.ofEntries(
            entry("emphasis", ElementClassification.INLINE_SPAN),
            entry("term", ElementClassification.INLINE_SPAN),
            entry("link", ElementClassification.INLINE_SPAN),
            entry("code", ElementClassification.INLINE_SPAN),
            entry("quote", ElementClassification.INLINE_SPAN),
            entry("foreign", ElementClassification.INLINE_SPAN),
            entry("sub", ElementClassification.INLINE_SPAN),
            entry("sup", ElementClassification.INLINE_SPAN),
            entry("newline", ElementClassification.INLINE_SPAN),

            entry("para", ElementClassification.BLOCK_CONTAINER),
            entry("list", ElementClassification.BLOCK_CONTAINER),
            entry("table", ElementClassification.BLOCK_CONTAINER),
            entry("figure", ElementClassification.BLOCK_CONTAINER),
            entry("equation", ElementClassification.BLOCK_CONTAINER),
            entry("media", ElementClassification.BLOCK_CONTAINER),
            entry("image", ElementClassification.BLOCK_CONTAINER),
            entry("preformat", ElementClassification.BLOCK_CONTAINER),

            entry("content", ElementClassification.STRUCTURAL_CONTAINER),
            entry("section", ElementClassification.STRUCTURAL_CONTAINER),
            entry("note", ElementClassification.STRUCTURAL_CONTAINER),
            entry("example", ElementClassification.STRUCTURAL_CONTAINER),
            entry("exercise", ElementClassification.STRUCTURAL_CONTAINER),
            entry("problem", ElementClassification.STRUCTURAL_CONTAINER),
            entry("solution", ElementClassification.STRUCTURAL_CONTAINER),
            entry("commentary", ElementClassification.STRUCTURAL_CONTAINER)
    );

    private ElementClassifier() {
    }

    public static ElementClassification classify(SourceNode node) {
        if (NamespaceTable.isMath(node.getNamespaceUri())) {
            return "math".equals(node.getLocalName())
                    ? ElementClassification.LEAF_MATH
                    : ElementClassification.OPAQUE_PASSTHROUGH;
        }
        if (!NamespaceTable.isContent(node.getNamespaceUri())) {
            return ElementClassification.OPAQUE_PASSTHROUGH;
        }
        return CONTENT_ELEMENTS.getOrDefault(node.getLocalName(), ElementClassification.OPAQUE_PASSTHROUGH);
    }
}
