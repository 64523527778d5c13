package me.christianrobert.cnxpretext.transformer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.cnxpretext.config.service.ConfigService;
import me.christianrobert.cnxpretext.transformer.context.NamespaceTable;
import me.christianrobert.cnxpretext.transformer.context.TransformationResult;
import me.christianrobert.cnxpretext.transformer.util.PretextEscaper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Assembles chapters (and appendices) from converted modules and writes one
 * {@code <slug>.ptx} per chapter.
 *
 * <p>Modules are read from {@code <modules-dir>/<moduleId>/index.cnxml}. A chapter is
 * written only when every one of its modules converted: a single unreadable or
 * malformed module fails the chapter and leaves no output file behind. Chapters of
 * a batch are independent of each other.</p>
 */
@ApplicationScoped
public class ChapterConversionService {

    private static final Logger log = LoggerFactory.getLogger(ChapterConversionService.class);

    static final String MODULE_FILE = "index.cnxml";
    static final String OUTPUT_EXTENSION = ".ptx";

    @Inject
    ModuleTransformationService moduleService;

    @Inject
    ConfigService configService;

    /**
     * Converts a chapter using the configured module and output directories.
     */
    public ChapterConversionResult convertChapter(ChapterDefinition chapter) {
        Path modulesDir = Paths.get(configService.getConfigValueAsString(ConfigService.MODULES_DIR));
        Path outputDir = Paths.get(configService.getConfigValueAsString(ConfigService.OUTPUT_DIR));
        return convertChapter(chapter, modulesDir, outputDir);
    }

    /**
     * Converts every chapter; a failed chapter does not stop the others.
     */
    public List<ChapterConversionResult> convertAll(List<ChapterDefinition> chapters) {
        List<ChapterConversionResult> results = new ArrayList<>();
        for (ChapterDefinition chapter : chapters) {
            try {
                results.add(convertChapter(chapter));
            } catch (RuntimeException e) {
                String chapterId = chapter != null ? chapter.getId() : null;
                log.error("Chapter {} failed", chapterId, e);
                results.add(ChapterConversionResult.failure(chapterId, List.of(),
                        "Chapter conversion failed: " + e.getMessage()));
            }
        }
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("Converted {} chapters, {} failed", results.size() - failed, failed);
        return results;
    }

    /**
     * Converts every chapter listed in a manifest file (see {@link ChapterManifest}).
     *
     * @throws me.christianrobert.cnxpretext.transformer.context.TransformationException when the manifest cannot be read
     */
    public List<ChapterConversionResult> convertManifest(Path manifest) {
        log.info("Reading chapter manifest {}", manifest);
        return convertAll(ChapterManifest.read(manifest));
    }

    public ChapterConversionResult convertChapter(ChapterDefinition chapter, Path modulesDir, Path outputDir) {
        String problem = validate(chapter);
        if (problem != null) {
            log.warn("Rejected chapter definition: {}", problem);
            return ChapterConversionResult.failure(chapter != null ? chapter.getId() : null, List.of(), problem);
        }

        String chapterId = chapter.getId().trim();
        log.info("Converting {} {} ({} sections)", chapter.getKind(), chapterId, chapter.getSections().size());

        List<String> failedModules = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        String introduction = null;
        String introductionModule = chapter.getIntroductionModuleId();
        if (introductionModule != null && !introductionModule.isBlank()) {
            TransformationResult result = readModule(modulesDir, introductionModule)
                    .map(cnxml -> moduleService.transformIntroduction(cnxml, chapterId));
            if (result.isSuccess()) {
                introduction = result.getPretext();
            } else {
                failedModules.add(introductionModule);
                errors.add(introductionModule + ": " + result.getErrorMessage());
            }
        }

        List<String> sections = new ArrayList<>();
        List<SectionDefinition> definitions = chapter.getSections();
        for (int i = 0; i < definitions.size(); i++) {
            SectionDefinition section = definitions.get(i);
            if (section == null) {
                String position = "section " + (i + 1);
                failedModules.add(position);
                errors.add(position + ": Section definition cannot be null");
                continue;
            }
            TransformationResult result = readModule(modulesDir, section.getModuleId())
                    .map(cnxml -> moduleService.transformModule(cnxml, section.getSectionId(), section.getTitle()));
            if (result.isSuccess()) {
                sections.add(result.getPretext());
            } else {
                String moduleId = String.valueOf(section.getModuleId());
                failedModules.add(moduleId);
                errors.add(moduleId + ": " + result.getErrorMessage());
            }
        }

        if (!failedModules.isEmpty()) {
            String errorMsg = "Chapter " + chapterId + " not written, " + failedModules.size()
                    + " module(s) failed: " + String.join("; ", errors);
            log.warn(errorMsg);
            return ChapterConversionResult.failure(chapterId, failedModules, errorMsg);
        }

        String document = assemble(chapter, introduction, sections);
        Path output = outputDir.resolve(chapter.getSlug().trim() + OUTPUT_EXTENSION);
        try {
            Files.createDirectories(outputDir);
            writeAtomically(output, document);
        } catch (IOException e) {
            log.error("Failed to write {}", output, e);
            return ChapterConversionResult.failure(chapterId, List.of(), "Failed to write " + output + ": " + e.getMessage());
        }

        log.info("Wrote {} with {} sections", output, sections.size());
        return ChapterConversionResult.success(chapterId, output.toString(), sections.size());
    }

    /**
     * The complete chapter document. Sections and introduction are already indented
     * one level by the module conversion.
     */
    static String assemble(ChapterDefinition chapter, String introduction, List<String> sections) {
        String root = ChapterDefinition.KIND_APPENDIX.equals(chapter.getKind())
                ? ChapterDefinition.KIND_APPENDIX : ChapterDefinition.KIND_CHAPTER;

        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<").append(root)
                .append(" xml:id=\"").append(PretextEscaper.escapeAttribute(chapter.getId().trim())).append("\"")
                .append(" xmlns:xi=\"").append(NamespaceTable.XINCLUDE).append("\">\n");
        if (chapter.getTitle() != null && !chapter.getTitle().isBlank()) {
            sb.append("  <title>").append(PretextEscaper.escapeText(chapter.getTitle().trim())).append("</title>\n");
        }
        if (introduction != null) {
            sb.append("\n").append(introduction);
        }
        for (String section : sections) {
            sb.append("\n").append(section);
        }
        sb.append("</").append(root).append(">\n");
        return sb.toString();
    }

    /**
     * Writes to a temporary file next to the target and moves it into place, so the
     * target is either the previous file or the complete new one.
     */
    static void writeAtomically(Path output, String document) throws IOException {
        Path temp = Files.createTempFile(output.toAbsolutePath().getParent(), output.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, document, StandardCharsets.UTF_8);
            Files.move(temp, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private ModuleSource readModule(Path modulesDir, String moduleId) {
        if (moduleId == null || moduleId.isBlank()) {
            return ModuleSource.failed("Module id cannot be null or empty");
        }
        Path file = modulesDir.resolve(moduleId.trim()).resolve(MODULE_FILE);
        try {
            log.debug("Reading module {}", file);
            return ModuleSource.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Cannot read module {}: {}", file, e.getMessage());
            return ModuleSource.failed("Cannot read " + file + ": " + e.getMessage());
        }
    }

    /**
     * Returns a description of what is wrong with the definition, or null if it is usable.
     */
    static String validate(ChapterDefinition chapter) {
        if (chapter == null) {
            return "Chapter definition cannot be null";
        }
        if (chapter.getId() == null || chapter.getId().isBlank()) {
            return "Chapter id cannot be null or empty";
        }
        if (chapter.getSlug() == null || chapter.getSlug().isBlank()) {
            return "Chapter slug cannot be null or empty";
        }
        if (chapter.getSlug().contains("/") || chapter.getSlug().contains("\\")) {
            return "Chapter slug must be a plain file name: " + chapter.getSlug();
        }
        String kind = chapter.getKind();
        if (kind != null && !ChapterDefinition.KIND_CHAPTER.equals(kind) && !ChapterDefinition.KIND_APPENDIX.equals(kind)) {
            return "Unknown chapter kind: " + kind;
        }
        return null;
    }

    /**
     * Module text, or the reason it could not be read.
     */
    private static final class ModuleSource {
        private final String cnxml;
        private final String error;

        private ModuleSource(String cnxml, String error) {
            this.cnxml = cnxml;
            this.error = error;
        }

        static ModuleSource of(String cnxml) {
            return new ModuleSource(cnxml, null);
        }

        static ModuleSource failed(String error) {
            return new ModuleSource(null, error);
        }

        TransformationResult map(Function<String, TransformationResult> conversion) {
            if (error != null) {
                return TransformationResult.failure(null, error);
            }
            return conversion.apply(cnxml);
        }
    }
}
