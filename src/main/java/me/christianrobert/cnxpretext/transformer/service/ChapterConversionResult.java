package me.christianrobert.cnxpretext.transformer.service;

import java.util.List;

/**
 * Outcome of converting one chapter. On failure nothing was written and
 * {@link #getFailedModules()} names the modules that caused it.
 */
public class ChapterConversionResult {

    private final boolean success;
    private final String chapterId;
    private final String outputPath;
    private final int sectionCount;
    private final List<String> failedModules;
    private final String errorMessage;

    private ChapterConversionResult(boolean success, String chapterId, String outputPath, int sectionCount,
                                    List<String> failedModules, String errorMessage) {
        this.success = success;
        this.chapterId = chapterId;
        this.outputPath = outputPath;
        this.sectionCount = sectionCount;
        this.failedModules = List.copyOf(failedModules);
        this.errorMessage = errorMessage;
    }

    public static ChapterConversionResult success(String chapterId, String outputPath, int sectionCount) {
        return new ChapterConversionResult(true, chapterId, outputPath, sectionCount, List.of(), null);
    }

    public static ChapterConversionResult failure(String chapterId, List<String> failedModules, String errorMessage) {
        return new ChapterConversionResult(false, chapterId, null, 0, failedModules, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getChapterId() {
        return chapterId;
    }

    /**
     * Written file, null on failure.
     */
    public String getOutputPath() {
        return outputPath;
    }

    public int getSectionCount() {
        return sectionCount;
    }

    public List<String> getFailedModules() {
        return failedModules;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        if (success) {
            return "ChapterConversionResult{success, chapter=" + chapterId + ", output=" + outputPath
                    + ", sections=" + sectionCount + "}";
        } else {
            return "ChapterConversionResult{failure, chapter=" + chapterId + ", failedModules=" + failedModules
                    + ", error=" + errorMessage + "}";
        }
    }
}
