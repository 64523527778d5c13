package me.christianrobert.cnxpretext.transformer.service;

/**
 * One module placed as a section of a chapter.
 */
public class SectionDefinition {

    private String moduleId;
    private String sectionId;
    private String title;

    public SectionDefinition() {
    }

    public SectionDefinition(String moduleId, String sectionId, String title) {
        this.moduleId = moduleId;
        this.sectionId = sectionId;
        this.title = title;
    }

    public String getModuleId() {
        return moduleId;
    }

    public void setModuleId(String moduleId) {
        this.moduleId = moduleId;
    }

    public String getSectionId() {
        return sectionId;
    }

    public void setSectionId(String sectionId) {
        this.sectionId = sectionId;
    }

    /**
     * Plain-text title; null to take the module's own.
     */
    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }
}
