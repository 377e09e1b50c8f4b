package com.phillippitts.speakstream.service.audio;

/**
 * Single source of truth for the PCM format streamed to the transcription service.
 * 16-bit signed PCM, mono, little-endian; the sample rate is negotiated with the
 * capture device and defaults to 16 kHz.
 */
public final class AudioFormat {

    /** Sample rate assumed until the capture source reports its effective rate. */
    public static final int DEFAULT_SAMPLE_RATE = 16_000;
    /** Bits per sample. */
    public static final int BITS_PER_SAMPLE = 16;
    /** Number of channels (mono). */
    public static final int CHANNELS = 1;
    /** Bytes per sample for 16-bit mono. */
    public static final int BYTES_PER_SAMPLE = (BITS_PER_SAMPLE / 8) * CHANNELS;

    /** Signed PCM flag for Java Sound. */
    public static final boolean SIGNED = true;
    /** Endian flag for Java Sound (false = little-endian). */
    public static final boolean BIG_ENDIAN = false;

    private AudioFormat() {}

    /**
     * Duration of {@code bytes} PCM bytes at {@code sampleRate}, floored to whole milliseconds.
     *
     * @return duration in ms; 0 for non-positive inputs or less than one millisecond of audio
     */
    public static long durationMs(long bytes, int sampleRate) {
        if (bytes <= 0 || sampleRate <= 0) {
            return 0;
        }
        return (bytes * 1000L) / ((long) BYTES_PER_SAMPLE * sampleRate);
    }

    /** Bytes needed for {@code millis} of audio at {@code sampleRate}. */
    public static int bytesFor(int millis, int sampleRate) {
        return (int) (((long) millis * sampleRate * BYTES_PER_SAMPLE) / 1000L);
    }
}
