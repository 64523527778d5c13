package me.christianrobert.cnxpretext.transformer;

import me.christianrobert.cnxpretext.transformer.builder.PretextCodeBuilder;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.parser.CnxmlParser;
import me.christianrobert.cnxpretext.transformer.parser.ParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sections, lists and figures.
 */
class StructureTransformationTest {

    private CnxmlParser parser;
    private PretextCodeBuilder builder;

    @BeforeEach
    void setUp() {
        parser = new CnxmlParser();
        builder = new PretextCodeBuilder();
    }

    private String convert(String content) {
        ParseResult result = parser.parse("<document xmlns=\"http://cnx.rice.edu/cnxml\" "
                + "xmlns:m=\"http://www.w3.org/1998/Math/MathML\" id=\"m1\"><title>T</title>"
                + "<content>" + content + "</content></document>");
        assertFalse(result.hasErrors(), "Parse should succeed: " + result.getErrorMessage());
        return builder.convertModule(result.getTree(), "sec1", "Title", TransformationContext.root("sec1"));
    }

    // ========== SECTIONS ==========

    @Test
    void nestedSections() {
        String pretext = convert("""
                <section id="s1"><title>Sub</title><para>a</para>
                  <section><title>Deep</title><para>b</para></section>
                </section>
                """);

        assertTrue(pretext.contains("    <subsection xml:id=\"s1\">\n      <title>Sub</title>\n      <p>a</p>\n"), pretext);
        assertTrue(pretext.contains("      <subsubsection xml:id=\"s1-section-3\">\n        <title>Deep</title>\n"), pretext);
        assertTrue(pretext.contains("        <p>b</p>\n      </subsubsection>\n    </subsection>\n"), pretext);
    }

    @Test
    void sectionWithoutIdUsesModuleScope() {
        String pretext = convert("<para>x</para><section><para>y</para></section>");

        assertTrue(pretext.contains("<subsection xml:id=\"sec1-section-2\">"), pretext);
    }

    @Test
    void sectionTitleKeepsInlineMarkup() {
        String pretext = convert("<section id=\"s2\"><title>The <emphasis effect=\"italics\">t</emphasis> test</title></section>");

        assertTrue(pretext.contains("<title>The <m>t</m> test</title>"), pretext);
    }

    // ========== LISTS ==========

    @Test
    void bulletedList() {
        String pretext = convert("<list id=\"l1\"><item>one</item><item>two <term>t</term></item></list>");

        assertTrue(pretext.contains("    <ul>\n      <li>one</li>\n      <li>two <term>t</term></li>\n    </ul>\n"), pretext);
    }

    @Test
    void enumeratedListWithMarker() {
        String pretext = convert("<list list-type=\"enumerated\" number-style=\"lower-alpha\"><item>a</item><item/></list>");

        assertTrue(pretext.contains("<ol marker=\"a\">"), pretext);
        assertTrue(pretext.contains("<li/>"), "Empty item stays an empty li: " + pretext);
    }

    @Test
    void enumeratedListWithUnknownStyleHasNoMarker() {
        String pretext = convert("<list list-type=\"enumerated\" number-style=\"fancy\"><item>a</item></list>");

        assertTrue(pretext.contains("<ol>"), pretext);
    }

    @Test
    void titledListIsWrapped() {
        String pretext = convert("<list id=\"l2\"><title>Steps</title><item>go</item></list>");

        assertTrue(pretext.contains("    <list xml:id=\"l2\">\n      <title>Steps</title>\n      <ul>\n        <li>go</li>\n"), pretext);
        assertTrue(pretext.contains("      </ul>\n    </list>\n"), pretext);
    }

    @Test
    void nestedListInsideItem() {
        String pretext = convert("<list><item>outer<list><item>inner</item></list></item></list>");

        int outer = pretext.indexOf("<li>outer");
        int inner = pretext.indexOf("<li>inner</li>");
        assertTrue(outer >= 0 && inner > outer, pretext);
        assertEquals(2, pretext.split("<ul>", -1).length - 1, "Both lists are emitted: " + pretext);
    }

    // ========== FIGURES ==========

    @Test
    void figureWithMediaAndCaption() {
        String pretext = convert("""
                <figure id="f1">
                  <media id="med1" alt="A rising curve"><image mime-type="image/jpeg" src="../../media/graph.jpg" width="300"/></media>
                  <caption>Growth of <emphasis effect="italics">y</emphasis></caption>
                </figure>
                """);

        assertTrue(pretext.contains("    <figure xml:id=\"f1\">\n      <caption>Growth of <m>y</m></caption>\n"), pretext);
        assertTrue(pretext.contains("      <image source=\"media/graph.jpg\" width=\"60%\">\n"
                + "        <description>A rising curve</description>\n      </image>\n"), pretext);
        assertTrue(pretext.contains("    </figure>\n"), pretext);
    }

    @Test
    void figureWithoutIdOrAlt() {
        String pretext = convert("<para>lead</para><figure><image src=\"../media/x.png\"/></figure>");

        assertTrue(pretext.contains("<figure xml:id=\"sec1-figure-2\">"), pretext);
        assertTrue(pretext.contains("<image source=\"media/x.png\"/>"), pretext);
    }

    @Test
    void subfiguresAreSideBySide() {
        String pretext = convert("""
                <figure id="f2">
                  <subfigure id="f2a"><media alt=""><image src="a.png"/></media></subfigure>
                  <subfigure><media><image src="b.png"/></media></subfigure>
                </figure>
                """);

        int side = pretext.indexOf("<sidebyside>");
        int first = pretext.indexOf("<figure xml:id=\"f2a\">");
        int second = pretext.indexOf("<figure xml:id=\"f2-b\">");
        assertTrue(side >= 0 && first > side && second > first, pretext);
        assertTrue(pretext.contains("<image source=\"b.png\"/>"), pretext);
    }

    @Test
    void mediaOutsideFigure() {
        String pretext = convert("<media alt=\"logo\"><image src=\"../../media/logo.png\" width=\"50%\"/></media>");

        assertTrue(pretext.contains("    <image source=\"media/logo.png\" width=\"50%\">\n"), pretext);
    }
}
