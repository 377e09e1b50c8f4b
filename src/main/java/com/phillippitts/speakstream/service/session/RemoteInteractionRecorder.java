package com.phillippitts.speakstream.service.session;

import com.phillippitts.speakstream.domain.InteractionRecord;
import com.phillippitts.speakstream.service.audio.AudioFormat;
import com.phillippitts.speakstream.service.rpc.TranscriptionServiceClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

/**
 * Stores interactions with the remote service's {@code createInteraction} call.
 */
public class RemoteInteractionRecorder implements InteractionRecorder {

    private static final Logger LOG = LogManager.getLogger(RemoteInteractionRecorder.class);

    static final int TITLE_LENGTH = 50;
    static final String EMPTY_TITLE = "No transcript";

    private final TranscriptionServiceClient rpcClient;
    private final Clock clock;

    public RemoteInteractionRecorder(TranscriptionServiceClient rpcClient) {
        this(rpcClient, Clock.systemUTC());
    }

    RemoteInteractionRecorder(TranscriptionServiceClient rpcClient, Clock clock) {
        this.rpcClient = Objects.requireNonNull(rpcClient, "rpcClient must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void createInteraction(String transcript, byte[] audio, int sampleRate, String errorMessage) {
        byte[] pcm = audio == null ? new byte[0] : audio;
        InteractionRecord record = new InteractionRecord(
                UUID.randomUUID().toString(),
                title(transcript),
                transcript,
                errorMessage,
                pcm,
                AudioFormat.durationMs(pcm.length, sampleRate),
                sampleRate,
                clock.instant());
        try {
            rpcClient.createInteraction(record);
            LOG.debug("Stored interaction {}", record);
        } catch (RuntimeException e) {
            LOG.warn("Failed to store interaction {}: {}", record.id(), e.getMessage());
        }
    }

    static String title(String transcript) {
        if (transcript == null || transcript.isBlank()) {
            return EMPTY_TITLE;
        }
        String t = transcript.trim();
        return t.length() <= TITLE_LENGTH ? t : t.substring(0, TITLE_LENGTH);
    }
}
