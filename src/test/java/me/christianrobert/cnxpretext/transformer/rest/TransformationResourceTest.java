package me.christianrobert.cnxpretext.transformer.rest;

import me.christianrobert.cnxpretext.transformer.context.TransformationException;
import me.christianrobert.cnxpretext.transformer.context.TransformationResult;
import me.christianrobert.cnxpretext.transformer.service.ChapterConversionResult;
import me.christianrobert.cnxpretext.transformer.service.ChapterConversionService;
import me.christianrobert.cnxpretext.transformer.service.ChapterDefinition;
import me.christianrobert.cnxpretext.transformer.service.ModuleTransformationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TransformationResourceTest {

    private ModuleTransformationService moduleService;
    private ChapterConversionService chapterService;
    private TransformationResource resource;

    @BeforeEach
    void setUp() {
        moduleService = mock(ModuleTransformationService.class);
        chapterService = mock(ChapterConversionService.class);

        resource = new TransformationResource();
        resource.moduleService = moduleService;
        resource.chapterService = chapterService;
    }

    @Test
    void moduleIsDelegated() {
        TransformationResult expected = TransformationResult.success("<document/>", "  <section/>\n");
        when(moduleService.transformModule("<document/>", "s1", "T", true)).thenReturn(expected);

        TransformationResult result = resource.transformModule("s1", "T", true, "<document/>");

        assertSame(expected, result);
    }

    @Test
    void failedModuleIsStillAResult() {
        when(moduleService.transformModule(anyString(), any(), any(), anyBoolean()))
                .thenReturn(TransformationResult.failure("<x", "Parse errors: line 1:3 bad"));

        TransformationResult result = resource.transformModule(null, null, false, "<x");

        assertFalse(result.isSuccess());
        assertEquals("Parse errors: line 1:3 bad", result.getErrorMessage());
    }

    @Test
    void emptyBodyIsRejectedWithoutConversion() {
        TransformationResult result = resource.transformModule("s1", null, false, "   ");

        assertFalse(result.isSuccess());
        assertEquals("CNXML cannot be empty", result.getErrorMessage());
        verify(moduleService, never()).transformModule(anyString(), any(), any(), anyBoolean());
    }

    @Test
    void chapterIsDelegated() {
        ChapterDefinition chapter = new ChapterDefinition("slug", "ch01", "T", List.of());
        ChapterConversionResult expected = ChapterConversionResult.success("ch01", "out/slug.ptx", 0);
        when(chapterService.convertChapter(chapter)).thenReturn(expected);

        assertSame(expected, resource.convertChapter(chapter));
    }

    @Test
    void nullBatchIsEmpty() {
        assertTrue(resource.convertChapters(null).isEmpty());
        verify(chapterService, never()).convertAll(any());
    }

    @Test
    void manifestPathIsRequired() {
        List<ChapterConversionResult> results = resource.convertManifest(" ");

        assertEquals(1, results.size());
        assertEquals("Manifest path cannot be empty", results.get(0).getErrorMessage());
        verifyNoInteractions(chapterService);
    }

    @Test
    void unusableManifestBecomesFailureEntry() {
        when(chapterService.convertManifest(any(Path.class)))
                .thenThrow(new TransformationException("Chapter manifest is empty"));

        List<ChapterConversionResult> results = resource.convertManifest("book.json");

        assertEquals(1, results.size());
        assertFalse(results.get(0).isSuccess());
        assertEquals("Chapter manifest is empty", results.get(0).getErrorMessage());
    }
}
