package me.christianrobert.cnxpretext.transformer.context;

/**
 * Thrown when a module or chapter manifest cannot be converted.
 * Optionally names the CNXML element involved and the conversion stage.
 */
public class TransformationException extends RuntimeException {

    private final String element;
    private final String stage;

    public TransformationException(String message) {
        super(message);
        this.element = null;
        this.stage = null;
    }

    public TransformationException(String message, Throwable cause) {
        super(message, cause);
        this.element = null;
        this.stage = null;
    }

    public TransformationException(String message, String element, String stage) {
        super(message);
        this.element = element;
        this.stage = stage;
    }

    public String getElement() {
        return element;
    }

    public String getStage() {
        return stage;
    }

    /**
     * The message followed by the element and stage, where known.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (element != null) {
            sb.append("\nElement: ").append(element);
        }
        if (stage != null) {
            sb.append("\nStage: ").append(stage);
        }
        return sb.toString();
    }
}
