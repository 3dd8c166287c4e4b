package com.phillippitts.speakerlink.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing PipelineException with contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw PipelineExceptionBuilder.create("Cannot read source file")
 *         .source("bigspeak")
 *         .cause(ioException)
 *         .metadata("path", path)
 *         .build();
 *
 * throw PipelineExceptionBuilder.create("Cannot write profile store")
 *         .metadata("path", output)
 *         .metadata("profiles", count)
 *         .build();
 * </pre>
 */
public final class PipelineExceptionBuilder {

    private final String message;
    private String sourceName;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private PipelineExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static PipelineExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new PipelineExceptionBuilder(message);
    }

    public PipelineExceptionBuilder source(String sourceName) {
        this.sourceName = sourceName;
        return this;
    }

    public PipelineExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public PipelineExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the PipelineException. The final message format is
     * {@code {message} (key1=val1, key2=val2)} followed by the source, when one was set.
     *
     * @return constructed PipelineException
     */
    public PipelineException build() {
        String detailedMessage = buildDetailedMessage();
        if (sourceName == null) {
            return cause != null
                    ? new PipelineException(detailedMessage, cause)
                    : new PipelineException(detailedMessage);
        }
        return cause != null
                ? new PipelineException(detailedMessage, sourceName, cause)
                : new PipelineException(detailedMessage, sourceName);
    }

    private String buildDetailedMessage() {
        if (metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        return sb.append(")").toString();
    }
}
