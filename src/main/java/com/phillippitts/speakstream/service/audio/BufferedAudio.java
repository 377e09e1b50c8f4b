package com.phillippitts.speakstream.service.audio;

import java.util.Arrays;

/**
 * Growable byte buffer retaining every frame accepted during one session, in arrival order.
 *
 * <p>Survives after the outbound queue drains so the audio can be persisted and measured
 * once the stream has completed. Thread-safe for one producer (capture callback) and any
 * number of readers.
 */
final class BufferedAudio {

    private static final int INITIAL_CAPACITY = 64 * 1024;

    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int size = 0;

    synchronized void append(byte[] src) {
        if (src.length == 0) {
            return;
        }
        ensureCapacity(size + src.length);
        System.arraycopy(src, 0, buffer, size, src.length);
        size += src.length;
    }

    synchronized int size() {
        return size;
    }

    synchronized byte[] toByteArray() {
        return Arrays.copyOf(buffer, size);
    }

    /**
     * Root-mean-square energy of the buffered samples normalized to 0..1.
     */
    synchronized double energy() {
        int samples = size / AudioFormat.BYTES_PER_SAMPLE;
        if (samples == 0) {
            return 0.0;
        }
        double sumOfSquares = 0;
        for (int i = 0; i + 1 < size; i += 2) {
            int sample = (short) ((buffer[i] & 0xFF) | (buffer[i + 1] << 8));
            sumOfSquares += (double) sample * sample;
        }
        return Math.sqrt(sumOfSquares / samples) / Short.MAX_VALUE;
    }

    synchronized void clear() {
        buffer = new byte[INITIAL_CAPACITY];
        size = 0;
    }

    private void ensureCapacity(int required) {
        if (required <= buffer.length) {
            return;
        }
        int newCapacity = Math.max(required, buffer.length * 2);
        buffer = Arrays.copyOf(buffer, newCapacity);
    }
}
