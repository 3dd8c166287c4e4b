package com.phillippitts.speakerlink.exception;

/**
 * Base exception for all speakerlink application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SpeakerLinkException extends RuntimeException {

    public SpeakerLinkException(String message) {
        super(message);
    }

    public SpeakerLinkException(String message, Throwable cause) {
        super(message, cause);
    }

    public SpeakerLinkException(Throwable cause) {
        super(cause);
    }
}
