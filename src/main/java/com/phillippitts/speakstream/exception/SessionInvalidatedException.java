package com.phillippitts.speakstream.exception;

/**
 * Thrown when stored credentials can no longer be refreshed and the user must sign in again.
 */
public class SessionInvalidatedException extends SpeakStreamException {

    public SessionInvalidatedException(String message) {
        super(message);
    }

    public SessionInvalidatedException(String message, Throwable cause) {
        super(message, cause);
    }
}
