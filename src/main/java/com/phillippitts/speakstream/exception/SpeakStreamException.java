package com.phillippitts.speakstream.exception;

/**
 * Base exception for all speak-stream application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class SpeakStreamException extends RuntimeException {

    public SpeakStreamException(String message) {
        super(message);
    }

    public SpeakStreamException(String message, Throwable cause) {
        super(message, cause);
    }

    public SpeakStreamException(Throwable cause) {
        super(cause);
    }
}
