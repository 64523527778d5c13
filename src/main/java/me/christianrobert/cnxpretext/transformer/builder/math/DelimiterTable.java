package me.christianrobert.cnxpretext.transformer.builder.math;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Fence glyph to LaTeX delimiter. Unmapped glyphs are used literally.
 */
public final class DelimiterTable {

    private static final Map<String, String> DELIMITERS = Map.ofEntries(
            entry("(", "("),
            entry(")", ")"),
            entry("[", "["),
            entry("]", "]"),
            entry("{", "\\{"),
            entry("}", "\\}"),
            entry("|", "|"),
            entry("‖", "\\|"),
            entry("∥", "\\|"),
            entry("⟨", "\\langle"),
            entry("⟩", "\\rangle"),
            entry("〈", "\\langle"),
            entry("〉", "\\rangle"),
            entry("⌊", "\\lfloor"),
            entry("⌋", "\\rfloor"),
            entry("⌈", "\\lceil"),
            entry("⌉", "\\rceil")
    );

    private DelimiterTable() {
    }

    public static String toLatex(String glyph) {
        if (glyph == null) {
            return "";
        }
        String trimmed = glyph.trim();
        return DELIMITERS.getOrDefault(trimmed, trimmed);
    }
}
