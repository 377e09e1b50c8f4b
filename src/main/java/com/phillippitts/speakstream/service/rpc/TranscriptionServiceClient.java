package com.phillippitts.speakstream.service.rpc;

import com.phillippitts.speakstream.domain.DictionaryItem;
import com.phillippitts.speakstream.domain.InteractionRecord;
import com.phillippitts.speakstream.domain.ModelSettings;
import com.phillippitts.speakstream.service.stream.StreamRequest;

import java.time.Instant;
import java.util.List;

/**
 * Remote transcription service: one client-streaming transcription call plus unary calls
 * for history sync and settings.
 *
 * <p>All methods block the calling thread. Failures are reported as
 * {@link com.phillippitts.speakstream.exception.RpcException}; a streaming call aborted via its
 * {@link CancellationSignal} fails with
 * {@link com.phillippitts.speakstream.exception.StreamCancelledException}.
 */
public interface TranscriptionServiceClient {

    /**
     * Sends the outbound sequence and waits for the single terminal response.
     *
     * <p>Each invocation iterates {@code requests} afresh, so a retry resends from the start.
     *
     * @param requests     outbound audio and control items, in send order
     * @param cancellation aborts the call when cancelled
     * @return transcript and optional structured error
     */
    TranscriptResponse transcribeStream(Iterable<StreamRequest> requests, CancellationSignal cancellation);

    InteractionRecord createInteraction(InteractionRecord interaction);

    InteractionRecord updateInteraction(InteractionRecord interaction);

    void deleteInteraction(String interactionId);

    List<InteractionRecord> listInteractionsSince(Instant since);

    List<DictionaryItem> listDictionaryItemsSince(Instant since);

    ModelSettings getAdvancedSettings();
}
