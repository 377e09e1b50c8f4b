package com.phillippitts.speakstream.service.session;

/** How a call to {@link SessionManager#completeSession()} ended. */
public enum CompletionOutcome {
    /** Transcript inserted and stored. */
    INSERTED,
    /** Transcript received but no insertion strategy succeeded; still stored. */
    INSERTION_FAILED,
    /** Service returned no text and no error. */
    EMPTY,
    /** Utterance shorter than the minimum; cancelled before any transcript. */
    DISCARDED,
    /** Service reported an error; a failed interaction was stored. */
    REMOTE_ERROR,
    /** Transport failure or timeout; nothing stored. */
    FAILED,
    /** Session was cancelled while completing. */
    CANCELLED,
    /** No session was running. */
    NO_SESSION
}
