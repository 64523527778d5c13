package me.christianrobert.cnxpretext.transformer.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import me.christianrobert.cnxpretext.transformer.context.TransformationException;
import me.christianrobert.cnxpretext.transformer.context.TransformationResult;
import me.christianrobert.cnxpretext.transformer.service.ChapterConversionResult;
import me.christianrobert.cnxpretext.transformer.service.ChapterConversionService;
import me.christianrobert.cnxpretext.transformer.service.ChapterDefinition;
import me.christianrobert.cnxpretext.transformer.service.ModuleTransformationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.List;

/**
 * REST endpoint for CNXML → PreTeXt conversion.
 *
 * <p>Usage:
 * <pre>
 * # Convert one module and look at the section it produces
 * curl -X POST "http://localhost:8080/api/transformation/module?sectionId=sec-6-1&amp;title=Exponential%20Functions" \
 *   -H "Content-Type: text/xml" \
 *   --data @modules/m00002/index.cnxml
 *
 * # Same, with a dump of the parsed source tree
 * curl -X POST "http://localhost:8080/api/transformation/module?sectionId=sec-6-1&amp;showTree=true" \
 *   -H "Content-Type: text/xml" --data @modules/m00002/index.cnxml
 *
 * # Convert and write a whole chapter
 * curl -X POST "http://localhost:8080/api/transformation/chapter" \
 *   -H "Content-Type: application/json" --data @chapter06.json
 * </pre>
 *
 * <p>Note: Always returns HTTP 200. Check "success" field in response.
 * A module that does not convert is a valid outcome, not an HTTP error.
 */
@Path("/api/transformation")
@Produces(MediaType.APPLICATION_JSON)
public class TransformationResource {

    private static final Logger log = LoggerFactory.getLogger(TransformationResource.class);

    @Inject
    ModuleTransformationService moduleService;

    @Inject
    ChapterConversionService chapterService;

    /**
     * Converts one module into a PreTeXt section.
     *
     * @param sectionId id for the section (defaults to the module id)
     * @param title section title (defaults to the module's metadata title)
     * @param showTree include the parsed source tree in the response
     * @param cnxml module source (text/xml or text/plain body)
     * @return TransformationResult as JSON (always HTTP 200, check "success" field)
     */
    @POST
    @Path("/module")
    @Consumes({MediaType.TEXT_XML, MediaType.APPLICATION_XML, MediaType.TEXT_PLAIN})
    public TransformationResult transformModule(
            @QueryParam("sectionId") String sectionId,
            @QueryParam("title") String title,
            @QueryParam("showTree") @DefaultValue("false") boolean showTree,
            String cnxml
    ) {
        log.info("Module conversion request received via REST API");
        log.debug("Section id: {}, title: {}", sectionId, title);

        if (cnxml == null || cnxml.trim().isEmpty()) {
            log.warn("Empty CNXML received");
            return TransformationResult.failure("", "CNXML cannot be empty");
        }

        TransformationResult result = moduleService.transformModule(cnxml, sectionId, title, showTree);

        if (result.isSuccess()) {
            log.info("Module conversion succeeded");
            if (result.hasSourceTree()) {
                log.debug("Source tree included in response");
            }
        } else {
            log.warn("Module conversion failed: {}", result.getErrorMessage());
        }
        return result;
    }

    /**
     * Converts a chapter and writes it to the configured output directory.
     */
    @POST
    @Path("/chapter")
    @Consumes(MediaType.APPLICATION_JSON)
    public ChapterConversionResult convertChapter(ChapterDefinition chapter) {
        log.info("Chapter conversion request received via REST API");
        return chapterService.convertChapter(chapter);
    }

    /**
     * Converts several chapters; each result stands on its own.
     */
    @POST
    @Path("/chapters")
    @Consumes(MediaType.APPLICATION_JSON)
    public List<ChapterConversionResult> convertChapters(List<ChapterDefinition> chapters) {
        log.info("Batch conversion request for {} chapters", chapters != null ? chapters.size() : 0);
        if (chapters == null) {
            return List.of();
        }
        return chapterService.convertAll(chapters);
    }

    /**
     * Converts every chapter of a manifest file on the server.
     *
     * @param path manifest location (JSON array of chapter definitions)
     * @return one result per chapter; a single failure entry when the manifest is unusable
     */
    @POST
    @Path("/manifest")
    public List<ChapterConversionResult> convertManifest(@QueryParam("path") String path) {
        log.info("Manifest conversion request for {}", path);
        if (path == null || path.isBlank()) {
            return List.of(ChapterConversionResult.failure(null, List.of(), "Manifest path cannot be empty"));
        }
        try {
            return chapterService.convertManifest(Paths.get(path.trim()));
        } catch (TransformationException e) {
            log.warn("Manifest conversion failed: {}", e.getMessage());
            return List.of(ChapterConversionResult.failure(null, List.of(), e.getDetailedMessage()));
        }
    }
}
