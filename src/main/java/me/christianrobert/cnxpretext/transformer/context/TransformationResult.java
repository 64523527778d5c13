package me.christianrobert.cnxpretext.transformer.context;

/**
 * Result of a module conversion.
 * Contains either the PreTeXt markup or an error message.
 * Optionally includes the source tree dump for debugging.
 */
public class TransformationResult {

    private final boolean success;
    private final String pretext;
    private final String errorMessage;
    private final String cnxml;
    private final String sourceTree;  // null unless requested

    private TransformationResult(boolean success, String pretext, String errorMessage, String cnxml, String sourceTree) {
        this.success = success;
        this.pretext = pretext;
        this.errorMessage = errorMessage;
        this.cnxml = cnxml;
        this.sourceTree = sourceTree;
    }

    public static TransformationResult success(String cnxml, String pretext) {
        return new TransformationResult(true, pretext, null, cnxml, null);
    }

    public static TransformationResult successWithTree(String cnxml, String pretext, String sourceTree) {
        return new TransformationResult(true, pretext, null, cnxml, sourceTree);
    }

    public static TransformationResult failure(String cnxml, String errorMessage) {
        return new TransformationResult(false, null, errorMessage, cnxml, null);
    }

    public static TransformationResult failure(String cnxml, TransformationException exception) {
        return new TransformationResult(false, null, exception.getDetailedMessage(), cnxml, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getPretext() {
        return pretext;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getCnxml() {
        return cnxml;
    }

    public String getSourceTree() {
        return sourceTree;
    }

    public boolean hasSourceTree() {
        return sourceTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "TransformationResult{success=true, pretextLength=" + (pretext != null ? pretext.length() : 0) +
                   (sourceTree != null ? ", hasSourceTree=true" : "") + "}";
        } else {
            return "TransformationResult{success=false, error='" + errorMessage + "'}";
        }
    }
}
