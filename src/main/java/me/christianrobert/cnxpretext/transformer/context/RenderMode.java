package me.christianrobert.cnxpretext.transformer.context;

/**
 * Whether inline rendering collapses to one text-bearing unit or may keep
 * block-level formatting verbatim.
 */
public enum RenderMode {
    /** Paragraph-level text: incidental whitespace from source line wrapping is collapsed. */
    INLINE,
    /** Nested block content: text is preserved verbatim. */
    BLOCK
}
