package com.phillippitts.speakstream.service.stream;

/**
 * Lifecycle of a streaming session.
 *
 * <pre>
 * IDLE → INITIALIZED → STREAMING → ENDING → COMPLETED
 *                    ↘ CANCELLED / ERRORED (from any active state)
 * </pre>
 */
public enum SessionState {
    IDLE,
    INITIALIZED,
    STREAMING,
    ENDING,
    COMPLETED,
    CANCELLED,
    ERRORED;

    /** Whether a session in this state blocks a new one from starting. */
    public boolean isActive() {
        return this == INITIALIZED || this == STREAMING || this == ENDING;
    }
}
