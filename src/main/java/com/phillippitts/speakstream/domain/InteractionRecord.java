package com.phillippitts.speakstream.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted history entry for one dictation attempt, successful or failed.
 *
 * @param id           client-generated identifier
 * @param title        short label (first characters of the transcript)
 * @param asrOutput    transcript text, empty on failure
 * @param errorMessage remote or local failure message, or {@code null} on success
 * @param rawAudio     PCM16LE audio of the attempt
 * @param durationMs   audio duration in milliseconds
 * @param sampleRate   sample rate of {@code rawAudio}
 * @param createdAt    creation time
 */
public record InteractionRecord(
        String id,
        String title,
        String asrOutput,
        String errorMessage,
        byte[] rawAudio,
        long durationMs,
        int sampleRate,
        Instant createdAt
) {

    public InteractionRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        title = title == null ? "" : title;
        asrOutput = asrOutput == null ? "" : asrOutput;
        rawAudio = rawAudio == null ? new byte[0] : rawAudio.clone();
    }

    @Override
    public byte[] rawAudio() {
        return rawAudio.clone();
    }

    public boolean isFailed() {
        return errorMessage != null;
    }

    @Override
    public String toString() {
        return "InteractionRecord[id=" + id + ", failed=" + isFailed() + ", durationMs=" + durationMs
                + ", audioBytes=" + rawAudio.length + "]";
    }
}
