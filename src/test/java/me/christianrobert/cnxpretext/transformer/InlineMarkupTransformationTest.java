package me.christianrobert.cnxpretext.transformer;

import me.christianrobert.cnxpretext.transformer.builder.PretextCodeBuilder;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.parser.CnxmlParser;
import me.christianrobert.cnxpretext.transformer.parser.ParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Inline vocabulary inside paragraphs: emphasis, links, scripts, math.
 */
class InlineMarkupTransformationTest {

    private CnxmlParser parser;
    private PretextCodeBuilder builder;

    @BeforeEach
    void setUp() {
        parser = new CnxmlParser();
        builder = new PretextCodeBuilder();
    }

    /**
     * Converts one paragraph and returns the inner text of its {@code <p>}.
     */
    private String paragraph(String inner) {
        ParseResult result = parser.parse("<content xmlns=\"http://cnx.rice.edu/cnxml\" "
                + "xmlns:m=\"http://www.w3.org/1998/Math/MathML\"><para>" + inner + "</para></content>");
        assertFalse(result.hasErrors(), "Parse should succeed: " + result.getErrorMessage());

        String pretext = builder.convertModule(result.getTree(), "s", null, TransformationContext.root("s"));
        int start = pretext.indexOf("<p>");
        int end = pretext.lastIndexOf("</p>");
        assertTrue(start >= 0 && end > start, "Expected a paragraph: " + pretext);
        return pretext.substring(start + 3, end);
    }

    // ========== EMPHASIS ==========

    @Test
    void boldIsTerm() {
        assertEquals("a <term>key idea</term>", paragraph("a <emphasis effect=\"bold\">key idea</emphasis>"));
    }

    @Test
    void emphasisWithoutEffectIsBold() {
        assertEquals("<term>note</term>", paragraph("<emphasis>note</emphasis>"));
    }

    @Test
    void italicWordIsEmphasis() {
        assertEquals("be <em>large</em>.", paragraph("be <emphasis effect=\"italics\">large</emphasis>."));
    }

    @Test
    void italicSingleLetterIsMathVariable() {
        assertEquals("Let <m>x</m> be", paragraph("Let <emphasis effect=\"italics\">x</emphasis> be"));
    }

    @Test
    void italicGreekLetterIsTranslated() {
        assertEquals("<m>\\mu</m>", paragraph("<emphasis effect=\"italics\">μ</emphasis>"));
    }

    @Test
    void italicTwoLetterWordStaysProse() {
        assertEquals("it <em>is</em>", paragraph("it <emphasis effect=\"italics\">is</emphasis>"));
    }

    @Test
    void underlineIsEmphasisAndSmallcapsIsUnwrapped() {
        assertEquals("<em>u</em> SC", paragraph(
                "<emphasis effect=\"underline\">u</emphasis> <emphasis effect=\"smallcaps\">SC</emphasis>"));
    }

    // ========== SIMPLE SPANS ==========

    @Test
    void simpleSpans() {
        assertEquals("<term>mode</term> <q>said</q> <foreign>et al.</foreign> <c>x = 1</c>", paragraph(
                "<term>mode</term> <quote>said</quote> <foreign>et al.</foreign> <code>x = 1</code>"));
    }

    @Test
    void scriptsBecomeMath() {
        assertEquals("cm<m>^{2}</m> and H<m>_{2}</m>O", paragraph("cm<sup>2</sup> and H<sub>2</sub>O"));
    }

    @Test
    void newlineRepeatsByCount() {
        assertEquals("a<nbsp/><nbsp/>b", paragraph("a<newline count=\"2\"/>b"));
        assertEquals("a<nbsp/>b", paragraph("a<newline/>b"));
    }

    @Test
    void newlineCountIsBounded() {
        assertEquals("a" + "<nbsp/>".repeat(10) + "b", paragraph("a<newline count=\"100000000\"/>b"));
        assertEquals("a<nbsp/>b", paragraph("a<newline count=\"-3\"/>b"));
        assertEquals("a<nbsp/>b", paragraph("a<newline count=\"many\"/>b"));
    }

    // ========== LINKS ==========

    @Test
    void externalLink() {
        assertEquals("<url href=\"http://openstax.org/?a=1&amp;b=2\">site</url>",
                paragraph("<link url=\"http://openstax.org/?a=1&amp;b=2\">site</link>"));
    }

    @Test
    void crossReferences() {
        assertEquals("<xref ref=\"m2-fig1\">Figure 1</xref>",
                paragraph("<link document=\"m2\" target-id=\"fig1\">Figure 1</link>"));
        assertEquals("<xref ref=\"fig2\"/>", paragraph("<link target-id=\"fig2\"/>"));
        assertEquals("<xref ref=\"m3\">next</xref>", paragraph("<link document=\"m3\">next</link>"));
    }

    @Test
    void linkWithoutTargetKeepsText() {
        assertEquals("plain", paragraph("<link>plain</link>"));
    }

    // ========== MATH AND FALLBACKS ==========

    @Test
    void inlineMath() {
        assertEquals("where <m>\\frac{1}{2}</m> holds",
                paragraph("where <m:math><m:mfrac><m:mn>1</m:mn><m:mn>2</m:mn></m:mfrac></m:math> holds"));
    }

    @Test
    void blockMathInText() {
        assertEquals("so <me>x</me>", paragraph("so <m:math display=\"block\"><m:mi>x</m:mi></m:math>"));
    }

    @Test
    void unknownInlineTagIsFlattened() {
        assertEquals("a L &amp; M b", paragraph("a <label>L <emphasis>&amp;</emphasis> M</label> b"));
    }

    @Test
    void nestedMarkupIsRenderedRecursively() {
        assertEquals("<term>mean <m>\\mu</m></term>",
                paragraph("<term>mean <m:math><m:mi>μ</m:mi></m:math></term>"));
    }
}
