package com.phillippitts.speakstream.exception;

/**
 * Signals that a streaming session was cancelled locally before the remote side responded.
 *
 * <p>This is an expected outcome of an explicit cancel and is never reported to the user.
 */
public class StreamCancelledException extends SpeakStreamException {

    public StreamCancelledException(String message) {
        super(message);
    }

    public StreamCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
