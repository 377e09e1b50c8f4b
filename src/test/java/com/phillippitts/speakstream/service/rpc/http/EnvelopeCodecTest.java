package com.phillippitts.speakstream.service.rpc.http;

import com.phillippitts.speakstream.domain.AudioFrame;
import com.phillippitts.speakstream.domain.DictationMode;
import com.phillippitts.speakstream.domain.ModelSettings;
import com.phillippitts.speakstream.exception.RpcException;
import com.phillippitts.speakstream.exception.RpcStatus;
import com.phillippitts.speakstream.service.rpc.TranscriptResponse;
import com.phillippitts.speakstream.service.stream.ConfigSnapshot;
import com.phillippitts.speakstream.service.stream.ModeUpdate;
import com.phillippitts.speakstream.service.stream.StreamRequest;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeCodecTest {

    @Test
    void modeUpdateCarriesOnlyTheMode() {
        JSONObject json = EnvelopeCodec.toJson(StreamRequest.control(new ModeUpdate(DictationMode.EDIT)));

        assertThat(json.similar(new JSONObject("{\"config\":{\"context\":{\"mode\":\"EDIT\"}}}"))).isTrue();
    }

    @Test
    void configSnapshotCarriesContextSettingsAndVocabulary() {
        ConfigSnapshot snapshot = new ConfigSnapshot(DictationMode.TRANSCRIBE, "Inbox", "Mail", "",
                List.of("Kubernetes", "Postgres"),
                new ModelSettings(null, null, null, null, "llama", 0.2, null, null, null));

        JSONObject config = EnvelopeCodec.toJson(StreamRequest.control(snapshot)).getJSONObject("config");

        assertThat(config.getJSONObject("context").getString("appName")).isEqualTo("Mail");
        assertThat(config.getJSONObject("context").getString("mode")).isEqualTo("TRANSCRIBE");
        assertThat(config.getJSONObject("llmSettings").getString("llmModel")).isEqualTo("llama");
        assertThat(config.getJSONObject("llmSettings").has("asrModel")).isFalse();
        assertThat(config.getJSONArray("vocabulary").toList()).containsExactly("Kubernetes", "Postgres");
    }

    @Test
    void audioIsBase64InLengthPrefixedEnvelope() {
        byte[] envelope = EnvelopeCodec.encode(StreamRequest.audio(new AudioFrame(new byte[] {1, 2, 3}, 16_000)));

        ByteBuffer buf = ByteBuffer.wrap(envelope);
        assertThat(buf.get()).isEqualTo(EnvelopeCodec.FLAG_DATA);
        int length = buf.getInt();
        assertThat(length).isEqualTo(envelope.length - EnvelopeCodec.HEADER_LENGTH);
        String payload = new String(envelope, EnvelopeCodec.HEADER_LENGTH, length, StandardCharsets.UTF_8);
        assertThat(new JSONObject(payload).getString("audioData")).isEqualTo("AQID");
    }

    @Test
    void decodesTranscriptFollowedByEmptyEndOfStream() {
        byte[] body = body(
                EnvelopeCodec.frame(EnvelopeCodec.FLAG_DATA, utf8("{\"transcript\":\"hello there\"}")),
                EnvelopeCodec.frame(EnvelopeCodec.FLAG_END_STREAM, utf8("{}")));

        TranscriptResponse response = EnvelopeCodec.decodeResponse(body);

        assertThat(response.transcript()).isEqualTo("hello there");
        assertThat(response.error()).isNull();
    }

    @Test
    void decodesStructuredTranscriptionError() {
        byte[] body = EnvelopeCodec.frame(EnvelopeCodec.FLAG_DATA, utf8(
                "{\"transcript\":\"\",\"error\":{\"code\":\"CLIENT_TRANSCRIPTION_QUALITY_ERROR\","
                        + "\"type\":\"quality\",\"message\":\"Audio too quiet\"}}"));

        TranscriptResponse response = EnvelopeCodec.decodeResponse(body);

        assertThat(response.error().code()).isEqualTo("CLIENT_TRANSCRIPTION_QUALITY_ERROR");
        assertThat(response.error().message()).isEqualTo("Audio too quiet");
        assertThat(response.error().provider()).isEmpty();
    }

    @Test
    void endOfStreamErrorBecomesRpcException() {
        byte[] body = EnvelopeCodec.frame(EnvelopeCodec.FLAG_END_STREAM,
                utf8("{\"error\":{\"code\":\"unauthenticated\",\"message\":\"token expired\"}}"));

        assertThatThrownBy(() -> EnvelopeCodec.decodeResponse(body))
                .isInstanceOfSatisfying(RpcException.class,
                        e -> assertThat(e.getStatus()).isEqualTo(RpcStatus.UNAUTHENTICATED));
    }

    @Test
    void shouldRejectTruncatedOrEmptyBody() {
        byte[] truncated = ByteBuffer.allocate(7).put(EnvelopeCodec.FLAG_DATA).putInt(50).array();

        assertThatThrownBy(() -> EnvelopeCodec.decodeResponse(truncated))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("Truncated");
        assertThatThrownBy(() -> EnvelopeCodec.decodeResponse(new byte[0]))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("no transcript");
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] body(byte[]... envelopes) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] e : envelopes) {
            out.writeBytes(e);
        }
        return out.toByteArray();
    }
}
