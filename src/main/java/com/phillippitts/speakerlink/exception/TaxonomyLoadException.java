package com.phillippitts.speakerlink.exception;

/**
 * Thrown when a taxonomy table cannot be read or fails validation.
 * This is a fatal startup error: no classification is possible without the tables.
 */
public class TaxonomyLoadException extends SpeakerLinkException {

    private final String resourcePath;

    public TaxonomyLoadException(String resourcePath, String reason) {
        super("Cannot load taxonomy table " + resourcePath + ": " + reason);
        this.resourcePath = resourcePath;
    }

    public TaxonomyLoadException(String resourcePath, String reason, Throwable cause) {
        super("Cannot load taxonomy table " + resourcePath + ": " + reason, cause);
        this.resourcePath = resourcePath;
    }

    public String getResourcePath() {
        return resourcePath;
    }
}
