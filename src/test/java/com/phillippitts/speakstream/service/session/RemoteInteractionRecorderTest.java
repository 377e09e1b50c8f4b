package com.phillippitts.speakstream.service.session;

import com.phillippitts.speakstream.domain.InteractionRecord;
import com.phillippitts.speakstream.exception.RpcException;
import com.phillippitts.speakstream.exception.RpcStatus;
import com.phillippitts.speakstream.testutil.FakeTranscriptionServiceClient;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class RemoteInteractionRecorderTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private final FakeTranscriptionServiceClient client = new FakeTranscriptionServiceClient();
    private final RemoteInteractionRecorder recorder =
            new RemoteInteractionRecorder(client, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void storesSuccessfulInteraction() {
        recorder.createInteraction("hello world", new byte[3200], 16_000, null);

        InteractionRecord stored = client.created.get(0);
        assertThat(stored.title()).isEqualTo("hello world");
        assertThat(stored.asrOutput()).isEqualTo("hello world");
        assertThat(stored.durationMs()).isEqualTo(100);
        assertThat(stored.createdAt()).isEqualTo(NOW);
        assertThat(stored.isFailed()).isFalse();
        assertThat(stored.id()).isNotBlank();
    }

    @Test
    void failedInteractionGetsPlaceholderTitle() {
        recorder.createInteraction("", new byte[640], 16_000, "Audio too quiet");

        InteractionRecord stored = client.created.get(0);
        assertThat(stored.title()).isEqualTo(RemoteInteractionRecorder.EMPTY_TITLE);
        assertThat(stored.errorMessage()).isEqualTo("Audio too quiet");
    }

    @Test
    void titleIsTrimmedAndTruncated() {
        String longText = "  " + "a".repeat(80) + "  ";

        assertThat(RemoteInteractionRecorder.title(longText)).hasSize(RemoteInteractionRecorder.TITLE_LENGTH);
        assertThat(RemoteInteractionRecorder.title(" short ")).isEqualTo("short");
        assertThat(RemoteInteractionRecorder.title(null)).isEqualTo("No transcript");
    }

    @Test
    void shouldSwallowStorageFailures() {
        client.unaryFailure = new RpcException(RpcStatus.UNAVAILABLE, "createInteraction", "down");

        assertThatCode(() -> recorder.createInteraction("hi", new byte[0], 16_000, null))
                .doesNotThrowAnyException();
        assertThat(client.created).isEmpty();
    }
}
