package com.phillippitts.speakstream.util;

/** Privacy-safe rendering of user text for logs. */
public final class LogSanitizer {

    private LogSanitizer() {}

    /**
     * Truncates the input to at most {@code max} characters; returns "" for null or non-positive max.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }
}
