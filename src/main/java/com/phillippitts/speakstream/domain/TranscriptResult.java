package com.phillippitts.speakstream.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Terminal payload of one streaming session.
 *
 * @param transcript  final text returned by the service (empty when nothing was recognized)
 * @param error       structured remote error, or {@code null} on success
 * @param audio       snapshot of all audio accepted during the session
 * @param sampleRate  sample rate in effect when the session finished
 */
public record TranscriptResult(String transcript, TranscriptionError error, byte[] audio, int sampleRate) {

    public TranscriptResult {
        transcript = transcript == null ? "" : transcript;
        Objects.requireNonNull(audio, "audio must not be null");
        audio = audio.clone();
    }

    @Override
    public byte[] audio() {
        return audio.clone();
    }

    public Optional<TranscriptionError> errorDetails() {
        return Optional.ofNullable(error);
    }

    public boolean hasError() {
        return error != null;
    }

    /** True when the transcript should be inserted: no error and some non-blank text. */
    public boolean isInsertable() {
        return error == null && !transcript.isBlank();
    }

    @Override
    public String toString() {
        return "TranscriptResult[chars=" + transcript.length() + ", error=" + error
                + ", audioBytes=" + audio.length + ", sampleRate=" + sampleRate + "]";
    }
}
