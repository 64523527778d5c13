package me.christianrobert.cnxpretext.transformer.context;

/**
 * Content model of a source element, as looked up in {@link ElementClassifier}.
 */
public enum ElementClassification {
    /** Inline markup inside running text (emphasis, link, term, ...). */
    INLINE_SPAN,
    /** Block unit holding inline content or a fixed shape (para, list, table, figure, ...). */
    BLOCK_CONTAINER,
    /** Container of other block units (section, note, example, exercise, ...). */
    STRUCTURAL_CONTAINER,
    /** Embedded MathML expression. */
    LEAF_MATH,
    /** Anything else: titles, labels, metadata and unknown vocabulary. */
    OPAQUE_PASSTHROUGH
}
