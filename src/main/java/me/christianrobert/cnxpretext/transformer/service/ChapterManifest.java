package me.christianrobert.cnxpretext.transformer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.christianrobert.cnxpretext.transformer.context.TransformationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the book manifest: a JSON array of {@link ChapterDefinition}s, one per
 * chapter or appendix, in book order.
 *
 * <pre>
 * [
 *   {"slug": "ch06", "id": "ch-exponential", "title": "Exponential Functions",
 *    "introductionModuleId": "m00001",
 *    "sections": [{"moduleId": "m00002", "sectionId": "sec-6-1"}]},
 *   {"slug": "appendix-a", "id": "app-proofs", "title": "Proofs", "kind": "appendix",
 *    "sections": [{"moduleId": "m00090", "sectionId": "sec-a-1"}]}
 * ]
 * </pre>
 */
public final class ChapterManifest {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ChapterManifest() {
    }

    public static List<ChapterDefinition> parse(String json) {
        if (json == null || json.isBlank()) {
            throw new TransformationException("Chapter manifest is empty");
        }
        try {
            List<ChapterDefinition> chapters = objectMapper.readValue(json, new TypeReference<List<ChapterDefinition>>() {
            });
            return chapters != null ? chapters : List.of();
        } catch (JsonProcessingException e) {
            throw new TransformationException("Invalid chapter manifest: " + e.getOriginalMessage(), e);
        }
    }

    public static List<ChapterDefinition> read(Path manifest) {
        try {
            return parse(Files.readString(manifest));
        } catch (IOException e) {
            throw new TransformationException("Cannot read chapter manifest " + manifest + ": " + e.getMessage(), e);
        }
    }
}
