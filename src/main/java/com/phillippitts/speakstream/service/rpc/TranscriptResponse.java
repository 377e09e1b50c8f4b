package com.phillippitts.speakstream.service.rpc;

import com.phillippitts.speakstream.domain.TranscriptionError;

/**
 * Terminal response of the streaming transcription call.
 *
 * @param transcript recognized text, empty when nothing was recognized
 * @param error      structured error reported by the service, or {@code null}
 */
public record TranscriptResponse(String transcript, TranscriptionError error) {

    public TranscriptResponse {
        transcript = transcript == null ? "" : transcript;
    }
}
