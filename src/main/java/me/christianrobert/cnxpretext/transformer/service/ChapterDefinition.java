package me.christianrobert.cnxpretext.transformer.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Which modules make up a chapter (or appendix) and where the result goes.
 *
 * <p>Example (JSON, as accepted by {@code POST /api/transformation/chapter}):
 * <pre>
 * {
 *   "slug": "ch06-exponential-functions",
 *   "id": "ch-exponential-logarithmic",
 *   "title": "Exponential and Logarithmic Functions",
 *   "introductionModuleId": "m00001",
 *   "sections": [
 *     {"moduleId": "m00002", "sectionId": "sec-exponential-functions", "title": "Exponential Functions"}
 *   ]
 * }
 * </pre>
 */
public class ChapterDefinition {

    public static final String KIND_CHAPTER = "chapter";
    public static final String KIND_APPENDIX = "appendix";

    private String slug;
    private String id;
    private String title;
    private String kind = KIND_CHAPTER;
    private String introductionModuleId;
    private List<SectionDefinition> sections = new ArrayList<>();

    public ChapterDefinition() {
    }

    public ChapterDefinition(String slug, String id, String title, List<SectionDefinition> sections) {
        this.slug = slug;
        this.id = id;
        this.title = title;
        setSections(sections);
    }

    /**
     * File name of the output, without extension.
     */
    public String getSlug() {
        return slug;
    }

    public void setSlug(String slug) {
        this.slug = slug;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    /**
     * Root element name: {@code chapter} or {@code appendix}.
     */
    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getIntroductionModuleId() {
        return introductionModuleId;
    }

    public void setIntroductionModuleId(String introductionModuleId) {
        this.introductionModuleId = introductionModuleId;
    }

    public List<SectionDefinition> getSections() {
        return sections;
    }

    public void setSections(List<SectionDefinition> sections) {
        this.sections = sections != null ? new ArrayList<>(sections) : new ArrayList<>();
    }
}
