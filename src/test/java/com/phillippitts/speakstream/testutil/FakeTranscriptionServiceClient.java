package com.phillippitts.speakstream.testutil;

import com.phillippitts.speakstream.domain.DictionaryItem;
import com.phillippitts.speakstream.domain.InteractionRecord;
import com.phillippitts.speakstream.domain.ModelSettings;
import com.phillippitts.speakstream.exception.StreamCancelledException;
import com.phillippitts.speakstream.service.rpc.CancellationSignal;
import com.phillippitts.speakstream.service.rpc.TranscriptResponse;
import com.phillippitts.speakstream.service.rpc.TranscriptionServiceClient;
import com.phillippitts.speakstream.service.stream.StreamRequest;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transcription service.
 *
 * <p>The streaming call consumes the whole outbound sequence (blocking like the real transport
 * until input ends), recording each item as it is pulled, then returns {@link #response} or throws {@link #streamFailure}.
 * A cancelled call fails with {@link StreamCancelledException}.
 */
public class FakeTranscriptionServiceClient implements TranscriptionServiceClient {

    public final List<StreamRequest> sent = new CopyOnWriteArrayList<>();
    public final List<InteractionRecord> created = new CopyOnWriteArrayList<>();
    public final List<Instant> dictionarySyncs = new CopyOnWriteArrayList<>();
    public final AtomicInteger streamCalls = new AtomicInteger();

    public volatile TranscriptResponse response = new TranscriptResponse("hello world", null);
    public volatile RuntimeException streamFailure;
    public volatile RuntimeException unaryFailure;
    public volatile List<DictionaryItem> dictionary = List.of();
    public volatile ModelSettings settings = ModelSettings.empty();

    @Override
    public TranscriptResponse transcribeStream(Iterable<StreamRequest> requests, CancellationSignal cancellation) {
        streamCalls.incrementAndGet();
        for (StreamRequest request : requests) {
            sent.add(request);
        }
        if (cancellation.isCancelled()) {
            throw new StreamCancelledException("cancelled");
        }
        if (streamFailure != null) {
            throw streamFailure;
        }
        return response;
    }

    @Override
    public InteractionRecord createInteraction(InteractionRecord interaction) {
        failIfConfigured();
        created.add(interaction);
        return interaction;
    }

    @Override
    public InteractionRecord updateInteraction(InteractionRecord interaction) {
        failIfConfigured();
        return interaction;
    }

    @Override
    public void deleteInteraction(String interactionId) {
        failIfConfigured();
    }

    @Override
    public List<InteractionRecord> listInteractionsSince(Instant since) {
        failIfConfigured();
        return List.copyOf(created);
    }

    @Override
    public List<DictionaryItem> listDictionaryItemsSince(Instant since) {
        failIfConfigured();
        dictionarySyncs.add(since == null ? Instant.EPOCH : since);
        return dictionary;
    }

    @Override
    public ModelSettings getAdvancedSettings() {
        failIfConfigured();
        return settings;
    }

    private void failIfConfigured() {
        if (unaryFailure != null) {
            throw unaryFailure;
        }
    }
}
