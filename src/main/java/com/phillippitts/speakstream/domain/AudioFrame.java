package com.phillippitts.speakstream.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * One slice of captured PCM16LE mono audio together with the sample rate that was
 * in effect when it was captured.
 *
 * <p>The byte array is copied on construction and on access so a frame can be shared
 * between the outbound stream and the retained session buffer without aliasing.
 *
 * @param data       raw PCM bytes (may be empty)
 * @param sampleRate sample rate in Hz at capture time
 */
public record AudioFrame(byte[] data, int sampleRate) {

    public AudioFrame {
        Objects.requireNonNull(data, "data must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    /** Number of PCM bytes in this frame. */
    public int length() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioFrame other)) {
            return false;
        }
        return sampleRate == other.sampleRate && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(data) + sampleRate;
    }

    @Override
    public String toString() {
        return "AudioFrame[bytes=" + data.length + ", sampleRate=" + sampleRate + "]";
    }
}
