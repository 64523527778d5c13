package me.christianrobert.cnxpretext.transformer.util;

import java.util.regex.Pattern;

/**
 * Escaping of text written into PreTeXt markup.
 *
 * <p>Escaping is single pass: an ampersand that already starts a character or
 * entity reference ({@code &amp;}, {@code &lt;}, {@code &#956;}, ...) is left alone,
 * so escaping already-escaped text does not produce {@code &amp;amp;}.</p>
 */
public final class PretextEscaper {

    private static final Pattern BARE_AMPERSAND =
            Pattern.compile("&(?!(?:amp|lt|gt|quot|apos|#[0-9]+|#x[0-9a-fA-F]+);)");

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private PretextEscaper() {
    }

    /**
     * Escapes {@code &}, {@code <} and {@code >} for element content.
     */
    public static String escapeText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = BARE_AMPERSAND.matcher(text).replaceAll("&amp;");
        if (result.indexOf('<') >= 0) {
            result = result.replace("<", "&lt;");
        }
        if (result.indexOf('>') >= 0) {
            result = result.replace(">", "&gt;");
        }
        return result;
    }

    /**
     * Escapes text for use inside a double-quoted attribute value.
     */
    public static String escapeAttribute(String value) {
        return escapeText(value).replace("\"", "&quot;");
    }

    /**
     * Collapses every run of whitespace (including source line breaks) to a single space.
     */
    public static String collapseWhitespace(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return WHITESPACE_RUN.matcher(text).replaceAll(" ");
    }
}
