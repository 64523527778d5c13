package me.christianrobert.cnxpretext.transformer.service;

import me.christianrobert.cnxpretext.config.service.ConfigService;
import me.christianrobert.cnxpretext.transformer.context.TransformationException;
import me.christianrobert.cnxpretext.transformer.context.TransformationResult;
import me.christianrobert.cnxpretext.transformer.parser.CnxmlParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChapterConversionServiceTest {

    private static final Path MODULES = Paths.get("src/test/resources/modules");

    @TempDir
    Path outputDir;

    private ChapterConversionService service;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();

        ModuleTransformationService moduleService = new ModuleTransformationService();
        moduleService.parser = new CnxmlParser();
        moduleService.configService = configService;

        service = new ChapterConversionService();
        service.moduleService = moduleService;
        service.configService = configService;
    }

    private static ChapterDefinition chapter(String slug, String id, SectionDefinition... sections) {
        return new ChapterDefinition(slug, id, "Sampling and Data", List.of(sections));
    }

    // ========== SUCCESS CASES ==========

    @Test
    void writesChapterWithIntroductionAndSections() throws IOException {
        ChapterDefinition definition = chapter("sampling-and-data", "ch01",
                new SectionDefinition("m00002", "sec-1-1", "Definitions"));
        definition.setIntroductionModuleId("m00001");

        ChapterConversionResult result = service.convertChapter(definition, MODULES, outputDir);

        assertTrue(result.isSuccess(), "Chapter should be written: " + result.getErrorMessage());
        assertEquals("ch01", result.getChapterId());
        assertEquals(1, result.getSectionCount());
        assertTrue(result.getFailedModules().isEmpty());

        Path output = outputDir.resolve("sampling-and-data.ptx");
        assertEquals(output.toString(), result.getOutputPath());
        String document = Files.readString(output, StandardCharsets.UTF_8);

        assertTrue(document.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<chapter xml:id=\"ch01\" xmlns:xi=\"http://www.w3.org/2001/XInclude\">\n"
                + "  <title>Sampling and Data</title>\n\n  <introduction>\n"), document);
        int objectives = document.indexOf("<objectives");
        int section = document.indexOf("<section xml:id=\"sec-1-1\">");
        assertTrue(objectives > 0 && section > objectives, "Introduction precedes the sections: " + document);
        assertTrue(document.endsWith("  </section>\n</chapter>\n"), document);
    }

    @Test
    void sectionsKeepDefinitionOrder() throws IOException {
        ChapterDefinition definition = chapter("order", "ch02",
                new SectionDefinition("m00002", "sec-b", "Second Listed First"),
                new SectionDefinition("m00002", "sec-a", "Listed Second"));

        ChapterConversionResult result = service.convertChapter(definition, MODULES, outputDir);

        assertTrue(result.isSuccess(), result.getErrorMessage());
        assertEquals(2, result.getSectionCount());
        String document = Files.readString(outputDir.resolve("order.ptx"), StandardCharsets.UTF_8);
        assertTrue(document.indexOf("xml:id=\"sec-b\"") < document.indexOf("xml:id=\"sec-a\""), document);
        assertFalse(document.contains("<introduction"), document);
    }

    @Test
    void appendixRoot() throws IOException {
        ChapterDefinition definition = chapter("appendix-a", "appA", new SectionDefinition("m00002", "app-a-1", null));
        definition.setKind(ChapterDefinition.KIND_APPENDIX);

        ChapterConversionResult result = service.convertChapter(definition, MODULES, outputDir);

        assertTrue(result.isSuccess(), result.getErrorMessage());
        String document = Files.readString(outputDir.resolve("appendix-a.ptx"), StandardCharsets.UTF_8);
        assertTrue(document.contains("<appendix xml:id=\"appA\""), document);
        assertTrue(document.endsWith("</appendix>\n"), document);
        assertTrue(document.contains("<title>Definitions of Statistics &amp; Key Terms</title>"),
                "Section title falls back to module metadata: " + document);
    }

    @Test
    void usesConfiguredDirectories() {
        configService.setConfigValue(ConfigService.MODULES_DIR, MODULES.toString());
        configService.setConfigValue(ConfigService.OUTPUT_DIR, outputDir.resolve("nested").toString());

        ChapterConversionResult result = service.convertChapter(
                chapter("configured", "ch03", new SectionDefinition("m00002", "s1", "S")));

        assertTrue(result.isSuccess(), result.getErrorMessage());
        assertTrue(Files.exists(outputDir.resolve("nested").resolve("configured.ptx")));
    }

    // ========== FAILURE CASES ==========

    @Test
    void failedModuleLeavesNoFile() {
        ChapterDefinition definition = chapter("broken", "ch04",
                new SectionDefinition("m00002", "s1", "Good"),
                new SectionDefinition("m00003", "s2", "Bad"));

        ChapterConversionResult result = service.convertChapter(definition, MODULES, outputDir);

        assertFalse(result.isSuccess());
        assertEquals(List.of("m00003"), result.getFailedModules());
        assertNull(result.getOutputPath());
        assertTrue(result.getErrorMessage().contains("Parse errors"), result.getErrorMessage());
        assertFalse(Files.exists(outputDir.resolve("broken.ptx")), "No partial chapter may be written");
    }

    @Test
    void missingModuleFails() {
        ChapterDefinition definition = chapter("missing", "ch05", new SectionDefinition("m99999", "s1", "Gone"));
        definition.setIntroductionModuleId("m00001");

        ChapterConversionResult result = service.convertChapter(definition, MODULES, outputDir);

        assertFalse(result.isSuccess());
        assertEquals(List.of("m99999"), result.getFailedModules());
        assertTrue(result.getErrorMessage().contains("Cannot read"), result.getErrorMessage());
    }

    @Test
    void rejectsInvalidDefinitions() {
        assertFalse(service.convertChapter(null, MODULES, outputDir).isSuccess());

        ChapterConversionResult result = service.convertChapter(chapter("../escape", "ch06"), MODULES, outputDir);
        assertFalse(result.isSuccess());
        assertTrue(result.getErrorMessage().contains("plain file name"), result.getErrorMessage());

        ChapterDefinition unknownKind = chapter("part", "ch07");
        unknownKind.setKind("part");
        assertEquals("Unknown chapter kind: part", ChapterConversionService.validate(unknownKind));

        assertEquals("Chapter id cannot be null or empty", ChapterConversionService.validate(chapter("x", " ")));
    }

    @Test
    void batchContinuesAfterFailure() {
        configService.setConfigValue(ConfigService.MODULES_DIR, MODULES.toString());
        configService.setConfigValue(ConfigService.OUTPUT_DIR, outputDir.toString());

        List<ChapterConversionResult> results = service.convertAll(List.of(
                chapter("first", "ch08", new SectionDefinition("m00003", "s1", "Bad")),
                chapter("second", "ch09", new SectionDefinition("m00002", "s1", "Good"))));

        assertEquals(2, results.size());
        assertFalse(results.get(0).isSuccess());
        assertTrue(results.get(1).isSuccess(), results.get(1).getErrorMessage());
    }

    @Test
    void nullSectionFailsOnlyItsChapter() {
        configService.setConfigValue(ConfigService.MODULES_DIR, MODULES.toString());
        configService.setConfigValue(ConfigService.OUTPUT_DIR, outputDir.toString());
        ChapterDefinition withNull = new ChapterDefinition("holes", "ch12", "Holes",
                Arrays.asList(new SectionDefinition("m00002", "s1", "Good"), null));

        List<ChapterConversionResult> results = service.convertAll(Arrays.asList(
                withNull,
                null,
                chapter("intact", "ch13", new SectionDefinition("m00002", "s1", "Good"))));

        assertEquals(3, results.size());
        assertFalse(results.get(0).isSuccess());
        assertEquals(List.of("section 2"), results.get(0).getFailedModules());
        assertTrue(results.get(0).getErrorMessage().contains("Section definition cannot be null"),
                results.get(0).getErrorMessage());
        assertFalse(Files.exists(outputDir.resolve("holes.ptx")));
        assertFalse(results.get(1).isSuccess());
        assertTrue(results.get(2).isSuccess(), results.get(2).getErrorMessage());
    }

    @Test
    void batchRecordsUnexpectedErrorsPerChapter() {
        ModuleTransformationService failing = mock(ModuleTransformationService.class);
        when(failing.transformModule(anyString(), anyString(), any()))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(TransformationResult.success("<section/>", "  <section xml:id=\"s1\"/>\n"));
        service.moduleService = failing;
        configService.setConfigValue(ConfigService.MODULES_DIR, MODULES.toString());
        configService.setConfigValue(ConfigService.OUTPUT_DIR, outputDir.toString());

        List<ChapterConversionResult> results = service.convertAll(List.of(
                chapter("first", "ch14", new SectionDefinition("m00002", "s1", "One")),
                chapter("second", "ch15", new SectionDefinition("m00002", "s1", "One"))));

        assertEquals(2, results.size());
        assertFalse(results.get(0).isSuccess());
        assertEquals("ch14", results.get(0).getChapterId());
        assertTrue(results.get(0).getErrorMessage().contains("boom"), results.get(0).getErrorMessage());
        assertTrue(results.get(1).isSuccess(), results.get(1).getErrorMessage());
    }

    @Test
    void failedWriteKeepsPreviousFile() throws IOException {
        Path target = outputDir.resolve("occupied.ptx");
        Files.createDirectories(target);
        Files.writeString(target.resolve("keep.txt"), "previous", StandardCharsets.UTF_8);

        ChapterConversionResult result = service.convertChapter(
                chapter("occupied", "ch16", new SectionDefinition("m00002", "s1", "One")), MODULES, outputDir);

        assertFalse(result.isSuccess());
        assertTrue(result.getErrorMessage().startsWith("Failed to write"), result.getErrorMessage());
        assertEquals("previous", Files.readString(target.resolve("keep.txt"), StandardCharsets.UTF_8));
        try (Stream<Path> files = Files.list(outputDir)) {
            assertEquals(List.of(target), files.collect(Collectors.toList()), "No temporary file is left behind");
        }
    }

    @Test
    void rewriteReplacesExistingChapter() throws IOException {
        Files.writeString(outputDir.resolve("again.ptx"), "stale", StandardCharsets.UTF_8);

        ChapterConversionResult result = service.convertChapter(
                chapter("again", "ch17", new SectionDefinition("m00002", "s1", "One")), MODULES, outputDir);

        assertTrue(result.isSuccess(), result.getErrorMessage());
        assertTrue(Files.readString(outputDir.resolve("again.ptx"), StandardCharsets.UTF_8).startsWith("<?xml"));
        try (Stream<Path> files = Files.list(outputDir)) {
            assertEquals(1, files.count(), "No temporary file is left behind");
        }
    }

    @Test
    void manifestConversion() throws IOException {
        configService.setConfigValue(ConfigService.MODULES_DIR, MODULES.toString());
        configService.setConfigValue(ConfigService.OUTPUT_DIR, outputDir.toString());
        Path manifest = outputDir.resolve("chapters.json");
        Files.writeString(manifest, """
                [
                  {"slug": "intro-chapter", "id": "ch10", "title": "Intro",
                   "introductionModuleId": "m00001",
                   "sections": [{"moduleId": "m00002", "sectionId": "s10-1", "title": "One"}]}
                ]
                """);

        List<ChapterConversionResult> results = service.convertManifest(manifest);

        assertEquals(1, results.size());
        assertTrue(results.get(0).isSuccess(), results.get(0).getErrorMessage());
        assertTrue(Files.exists(outputDir.resolve("intro-chapter.ptx")));
    }

    @Test
    void unreadableManifestThrows() {
        assertThrows(TransformationException.class, () -> service.convertManifest(outputDir.resolve("absent.json")));
    }

    // ========== ASSEMBLY ==========

    @Test
    void assembleWithoutTitleOrIntroduction() {
        ChapterDefinition definition = new ChapterDefinition("s", "c1", null, List.of());

        String document = ChapterConversionService.assemble(definition, null, List.of("  <section xml:id=\"a\"/>\n"));

        assertEquals("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<chapter xml:id=\"c1\" xmlns:xi=\"http://www.w3.org/2001/XInclude\">\n"
                + "\n  <section xml:id=\"a\"/>\n"
                + "</chapter>\n", document);
    }
}
