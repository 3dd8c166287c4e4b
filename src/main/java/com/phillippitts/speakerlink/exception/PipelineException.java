package com.phillippitts.speakerlink.exception;

/**
 * Thrown when a pipeline collaborator (source reader or profile sink) fails.
 * This may occur due to unreadable input files or an unwritable profile store.
 */
public class PipelineException extends SpeakerLinkException {

    private final String sourceName;

    public PipelineException(String message) {
        super(message);
        this.sourceName = "unknown";
    }

    public PipelineException(String message, String sourceName) {
        super(message + " (source: " + sourceName + ")");
        this.sourceName = sourceName;
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
        this.sourceName = "unknown";
    }

    public PipelineException(String message, String sourceName, Throwable cause) {
        super(message + " (source: " + sourceName + ")", cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
