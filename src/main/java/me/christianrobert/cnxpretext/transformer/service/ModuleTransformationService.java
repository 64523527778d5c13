package me.christianrobert.cnxpretext.transformer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.cnxpretext.config.service.ConfigService;
import me.christianrobert.cnxpretext.transformer.builder.PretextCodeBuilder;
import me.christianrobert.cnxpretext.transformer.context.ConversionOptions;
import me.christianrobert.cnxpretext.transformer.context.NamespaceTable;
import me.christianrobert.cnxpretext.transformer.context.TransformationContext;
import me.christianrobert.cnxpretext.transformer.context.TransformationException;
import me.christianrobert.cnxpretext.transformer.context.TransformationResult;
import me.christianrobert.cnxpretext.transformer.model.SourceNode;
import me.christianrobert.cnxpretext.transformer.parser.CnxmlParser;
import me.christianrobert.cnxpretext.transformer.parser.ParseResult;
import me.christianrobert.cnxpretext.transformer.util.SourceTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Converts one CNXML module into PreTeXt. Entry point for chapter assembly and the REST endpoint.
 *
 * <p>Architecture:
 * <pre>
 * CNXML → DOM parse → SourceNode tree → PretextCodeBuilder → PreTeXt fragment
 *             ↓              ↓                  ↓
 *        CnxmlParser     ParseResult      LatexMathBuilder (math spans)
 * </pre>
 *
 * <p>Usage:
 * <pre>
 * TransformationResult result = service.transformModule(cnxml, "sec-6-1", "Exponential Functions");
 * if (result.isSuccess()) {
 *     String section = result.getPretext();
 * } else {
 *     // result.getErrorMessage()
 * }
 * </pre>
 */
@ApplicationScoped
public class ModuleTransformationService {

    private static final Logger log = LoggerFactory.getLogger(ModuleTransformationService.class);

    @Inject
    CnxmlParser parser;

    @Inject
    ConfigService configService;

    public TransformationResult transformModule(String cnxml, String sectionId, String title) {
        return transformModule(cnxml, sectionId, title, false);
    }

    /**
     * Converts a module into a {@code <section>} fragment.
     *
     * @param cnxml complete module source
     * @param sectionId id of the emitted section; the module's own id when blank
     * @param title plain-text section title; the module's metadata title when blank
     * @param includeTree whether to attach a dump of the parsed tree (for debugging)
     * @return the section, or the reason the module could not be converted
     */
    public TransformationResult transformModule(String cnxml, String sectionId, String title, boolean includeTree) {
        return convert(cnxml, includeTree, (document, options) -> {
            String id = resolveSectionId(document, sectionId);
            String resolvedTitle = resolveTitle(document, title);
            log.debug("Converting module to section {} ({})", id, resolvedTitle);
            return new PretextCodeBuilder().convertModule(document, id, resolvedTitle,
                    TransformationContext.root(id, options));
        });
    }

    /**
     * Converts a module into a chapter {@code <introduction>}.
     *
     * @param chapterId id of the enclosing chapter, scope for synthesized ids
     */
    public TransformationResult transformIntroduction(String cnxml, String chapterId) {
        return convert(cnxml, false, (document, options) -> {
            log.debug("Converting introduction for {}", chapterId);
            return new PretextCodeBuilder().convertIntroduction(document,
                    TransformationContext.root(chapterId + "-introduction", options));
        });
    }

    private TransformationResult convert(String cnxml, boolean includeTree,
                                         BiFunction<SourceNode, ConversionOptions, String> conversion) {
        if (cnxml == null || cnxml.trim().isEmpty()) {
            return TransformationResult.failure(cnxml, "CNXML cannot be null or empty");
        }
        log.trace("CNXML: {}", cnxml);

        try {
            ParseResult parseResult = parser.parse(cnxml);
            if (parseResult.hasErrors()) {
                String errorMsg = "Parse errors: " + parseResult.getErrorMessage();
                log.warn("Parse failed: {}", errorMsg);
                return TransformationResult.failure(cnxml, errorMsg);
            }

            SourceNode document = parseResult.getTree();
            if (PretextCodeBuilder.findContent(document).isEmpty()) {
                log.warn("Module has no content element, emitting an empty shell");
            }

            String pretext = conversion.apply(document, options());
            log.info("Successfully converted module ({} characters)", pretext.length());

            if (includeTree) {
                return TransformationResult.successWithTree(cnxml, pretext, SourceTreeFormatter.format(document));
            }
            return TransformationResult.success(cnxml, pretext);

        } catch (TransformationException e) {
            log.error("Transformation failed: {}", e.getDetailedMessage(), e);
            return TransformationResult.failure(cnxml, e);

        } catch (Exception e) {
            log.error("Unexpected error during transformation", e);
            return TransformationResult.failure(cnxml, "Unexpected error: " + e.getMessage());
        }
    }

    private ConversionOptions options() {
        return configService != null ? ConversionOptions.fromConfig(configService) : ConversionOptions.defaults();
    }

    /**
     * The caller's id, else the module's {@code id} attribute.
     *
     * @throws TransformationException when neither is available
     */
    static String resolveSectionId(SourceNode document, String sectionId) {
        if (sectionId != null && !sectionId.isBlank()) {
            return sectionId.trim();
        }
        String moduleId = document.getAttribute("id");
        if (moduleId != null && !moduleId.isBlank()) {
            return moduleId.trim();
        }
        throw new TransformationException("No section id given and the module has no id",
                document.getLocalName(), "section id resolution");
    }

    /**
     * The caller's title, else {@code md:title} from the metadata, else the document's {@code title}.
     */
    static String resolveTitle(SourceNode document, String title) {
        if (title != null && !title.isBlank()) {
            return title.trim();
        }
        Optional<SourceNode> metadataTitle = document.findDescendant(NamespaceTable.METADATA, "title");
        if (metadataTitle.isPresent() && !metadataTitle.get().flattenText().isBlank()) {
            return metadataTitle.get().flattenText().trim();
        }
        return document.findChild(NamespaceTable.CONTENT, "title")
                .map(t -> t.flattenText().trim())
                .orElse("");
    }
}
