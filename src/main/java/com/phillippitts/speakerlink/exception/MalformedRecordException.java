package com.phillippitts.speakerlink.exception;

/**
 * Thrown by a source adapter when a raw document cannot become a source record,
 * most commonly because it has no usable name. The pipeline logs and skips it.
 */
public class MalformedRecordException extends SpeakerLinkException {

    private final String sourceName;
    private final String sourceLocalId;

    public MalformedRecordException(String sourceName, String sourceLocalId, String reason) {
        super("Malformed " + sourceName + " document (id: " + sourceLocalId + "): " + reason);
        this.sourceName = sourceName;
        this.sourceLocalId = sourceLocalId;
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getSourceLocalId() {
        return sourceLocalId;
    }
}
