package com.phillippitts.speakstream.util;

/**
 * Elapsed-time helpers for {@link System#nanoTime()} measurements.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {}

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }
}
