package com.phillippitts.speakstream.exception;

/**
 * Thrown when a session lifecycle operation is invoked in a state that does not allow it,
 * e.g. opening the stream twice for the same session.
 */
public class SessionStateException extends SpeakStreamException {

    private final String state;

    public SessionStateException(String message, String state) {
        super(message + " (state: " + state + ")");
        this.state = state;
    }

    public String getState() {
        return state;
    }
}
