package com.phillippitts.speakstream.util;

import java.time.Duration;

/**
 * Fixed timeouts for thread and subprocess lifecycle management.
 */
public final class Timeouts {

    /**
     * Capture thread join on stop. Long enough for the final chunk to be read and delivered
     * before the session measures its duration.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /** Capture thread join during application shutdown (best-effort). */
    public static final Duration CAPTURE_THREAD_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Upper bound for one osascript invocation while inspecting the foreground app. */
    public static final Duration FOREGROUND_QUERY_TIMEOUT = Duration.ofMillis(1500);

    /** Wait for a cancelled stream to settle before the next session may start. */
    public static final Duration CANCEL_SETTLE_TIMEOUT = Duration.ofMillis(2000);

    private Timeouts() {}
}
