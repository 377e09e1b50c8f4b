package com.phillippitts.speakstream.service.rpc.http;

import com.phillippitts.speakstream.domain.InteractionRecord;
import com.phillippitts.speakstream.domain.ModelSettings;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RpcJsonMapperTest {

    @Test
    void readsSettingsNestedUnderLlm() {
        ModelSettings settings = RpcJsonMapper.modelSettings(new JSONObject(
                "{\"llm\":{\"llmProvider\":\"groq\",\"noSpeechThreshold\":0.6,\"asrPrompt\":\"\"}}"));

        assertThat(settings.llmProvider()).isEqualTo("groq");
        assertThat(settings.noSpeechThreshold()).isEqualTo(0.6);
        assertThat(settings.asrPrompt()).isNull();
    }

    @Test
    void emptySettingsSerializeToEmptyObject() {
        assertThat(RpcJsonMapper.toJson(ModelSettings.empty()).isEmpty()).isTrue();
    }

    @Test
    void failedInteractionCarriesErrorUnderLlmOutput() {
        InteractionRecord failed = new InteractionRecord("id-1", "No transcript", "", "Audio too quiet",
                new byte[] {1, 2}, 0, 16_000, Instant.parse("2024-05-01T10:00:00Z"));

        JSONObject json = RpcJsonMapper.toJson(failed);

        assertThat(json.getJSONObject("llmOutput").getString("error")).isEqualTo("Audio too quiet");
        assertThat(json.getString("rawAudio")).isEqualTo("AQI=");
        InteractionRecord parsed = RpcJsonMapper.interaction(json);
        assertThat(parsed.isFailed()).isTrue();
        assertThat(parsed.rawAudio()).containsExactly(1, 2);
        assertThat(parsed.createdAt()).isEqualTo(failed.createdAt());
    }

    @Test
    void successfulInteractionHasNoLlmOutput() {
        InteractionRecord ok = new InteractionRecord("id-2", "hello", "hello", null,
                new byte[0], 100, 16_000, Instant.EPOCH);

        assertThat(RpcJsonMapper.toJson(ok).has("llmOutput")).isFalse();
    }
}
