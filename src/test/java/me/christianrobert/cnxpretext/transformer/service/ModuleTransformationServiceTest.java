package me.christianrobert.cnxpretext.transformer.service;

import me.christianrobert.cnxpretext.config.service.ConfigService;
import me.christianrobert.cnxpretext.transformer.context.TransformationResult;
import me.christianrobert.cnxpretext.transformer.parser.CnxmlParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end module conversion: CNXML text → parse → PreTeXt fragment.
 *
 * Note: Creates the service manually; the CDI fields are assigned directly.
 */
class ModuleTransformationServiceTest {

    private static final Path MODULES = Paths.get("src/test/resources/modules");

    private ModuleTransformationService service;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        service = new ModuleTransformationService();
        service.parser = new CnxmlParser();
        service.configService = configService;
    }

    private static String module(String moduleId) throws IOException {
        return Files.readString(MODULES.resolve(moduleId).resolve("index.cnxml"), StandardCharsets.UTF_8);
    }

    // ========== SUCCESS CASES ==========

    @Test
    void sectionFromFixture() throws IOException {
        TransformationResult result = service.transformModule(module("m00002"), "sec-1-1", "Definitions");

        assertTrue(result.isSuccess(), "Conversion should succeed: " + result.getErrorMessage());
        String pretext = result.getPretext();
        assertTrue(pretext.startsWith("  <section xml:id=\"sec-1-1\">\n    <title>Definitions</title>\n"), pretext);
        assertTrue(pretext.contains("<p xml:id=\"fs-p1\">The science of <term>statistics</term> deals with the collection, analysis, "
                + "interpretation, and presentation of <term>data</term>.</p>"), pretext);
        assertTrue(pretext.contains("<m>\\overline{x}</m> and estimates <m>\\mu</m>."), pretext);
        assertTrue(pretext.contains("<subsection xml:id=\"fs-key\">"), pretext);
        assertTrue(pretext.contains("<em>population</em>"), pretext);
        assertTrue(pretext.contains("<exercise xml:id=\"fs-ex1\">\n      <title>Try It</title>"), pretext);
        assertNull(result.getErrorMessage());
        assertFalse(result.hasSourceTree());
    }

    @Test
    void idAndTitleFallBackToModule() throws IOException {
        TransformationResult result = service.transformModule(module("m00002"), null, " ");

        assertTrue(result.isSuccess(), result.getErrorMessage());
        assertTrue(result.getPretext().startsWith("  <section xml:id=\"m00002\">\n"
                + "    <title>Definitions of Statistics &amp; Key Terms</title>\n"), result.getPretext());
    }

    @Test
    void titleFallsBackToDocumentTitleWithoutMetadata() {
        String cnxml = "<document xmlns=\"http://cnx.rice.edu/cnxml\" id=\"m7\"><title>Plain Title</title>"
                + "<content><para>x</para></content></document>";

        TransformationResult result = service.transformModule(cnxml, null, null);

        assertTrue(result.isSuccess(), result.getErrorMessage());
        assertTrue(result.getPretext().contains("<title>Plain Title</title>"), result.getPretext());
    }

    @Test
    void introductionFromFixture() throws IOException {
        TransformationResult result = service.transformIntroduction(module("m00001"), "ch01");

        assertTrue(result.isSuccess(), result.getErrorMessage());
        String pretext = result.getPretext();
        assertTrue(pretext.startsWith("  <introduction>\n"), pretext);
        assertTrue(pretext.endsWith("  </introduction>\n"), pretext);
        assertTrue(pretext.contains("<figure xml:id=\"fig-intro\">"), pretext);
        assertTrue(pretext.contains("<image source=\"media/CNX_Stats_C01_CO.jpg\" width=\"80%\">"), pretext);
        assertTrue(pretext.contains("<objectives xml:id=\"fs-obj\">\n      <title>Chapter Objectives</title>"), pretext);
        assertTrue(pretext.contains("<li>Recognize and differentiate between key terms.</li>"), pretext);
    }

    @Test
    void configuredRatioChangesImageWidth() throws IOException {
        configService.setConfigValue(ConfigService.PIXELS_PER_PERCENT, 10);

        TransformationResult result = service.transformIntroduction(module("m00001"), "ch01");

        assertTrue(result.getPretext().contains("width=\"40%\""), result.getPretext());
    }

    @Test
    void worksWithoutConfiguration() throws IOException {
        service.configService = null;

        TransformationResult result = service.transformIntroduction(module("m00001"), "ch01");

        assertTrue(result.isSuccess());
        assertTrue(result.getPretext().contains("width=\"80%\""), result.getPretext());
    }

    @Test
    void sourceTreeOnRequest() throws IOException {
        TransformationResult result = service.transformModule(module("m00002"), "s", "t", true);

        assertTrue(result.isSuccess());
        assertTrue(result.hasSourceTree());
        assertTrue(result.getSourceTree().contains("content"), result.getSourceTree());
        assertTrue(result.getSourceTree().contains("m:math"), result.getSourceTree());
    }

    @Test
    void moduleWithoutContentIsAnEmptySection() {
        TransformationResult result = service.transformModule(
                "<document xmlns=\"http://cnx.rice.edu/cnxml\" id=\"m8\"><title>T</title></document>", null, null);

        assertTrue(result.isSuccess(), result.getErrorMessage());
        assertEquals("  <section xml:id=\"m8\">\n    <title>T</title>\n  </section>\n", result.getPretext());
    }

    // ========== ERROR CASES ==========

    @Test
    void malformedModuleFails() throws IOException {
        TransformationResult result = service.transformModule(module("m00003"), "s", "t");

        assertFalse(result.isSuccess());
        assertTrue(result.isFailure());
        assertNull(result.getPretext());
        assertTrue(result.getErrorMessage().startsWith("Parse errors: "), result.getErrorMessage());
    }

    @Test
    void emptyInputFails() {
        assertEquals("CNXML cannot be null or empty", service.transformModule(null, "s", "t").getErrorMessage());
        assertEquals("CNXML cannot be null or empty", service.transformModule("  \n", "s", "t").getErrorMessage());
    }

    @Test
    void missingSectionIdFails() {
        TransformationResult result = service.transformModule(
                "<document xmlns=\"http://cnx.rice.edu/cnxml\"><content><para>x</para></content></document>", null, "T");

        assertFalse(result.isSuccess());
        assertTrue(result.getErrorMessage().contains("No section id given"), result.getErrorMessage());
        assertTrue(result.getErrorMessage().endsWith("\nElement: document\nStage: section id resolution"),
                result.getErrorMessage());
    }
}
