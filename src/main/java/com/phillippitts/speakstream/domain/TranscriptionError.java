package com.phillippitts.speakstream.domain;

import java.util.Objects;

/**
 * Structured error reported by the remote service alongside (or instead of) a transcript.
 *
 * @param code     machine-readable code, e.g. {@code CLIENT_TRANSCRIPTION_QUALITY_ERROR}
 * @param type     error category as reported by the provider
 * @param message  human-readable message (may be shown to the user)
 * @param provider upstream provider that raised the error, or empty
 */
public record TranscriptionError(String code, String type, String message, String provider) {

    public TranscriptionError {
        Objects.requireNonNull(message, "message must not be null");
        code = code == null ? "" : code;
        type = type == null ? "" : type;
        provider = provider == null ? "" : provider;
    }
}
