package com.phillippitts.speakstream.service.rpc.http;

import com.phillippitts.speakstream.domain.DictionaryItem;
import com.phillippitts.speakstream.domain.InteractionRecord;
import com.phillippitts.speakstream.domain.ModelSettings;
import com.phillippitts.speakstream.exception.RpcException;
import com.phillippitts.speakstream.exception.RpcStatus;
import org.json.JSONObject;

import java.time.Instant;
import java.util.Base64;

/**
 * JSON mapping for unary call payloads. Field names follow the service's camelCase JSON form.
 */
final class RpcJsonMapper {

    private RpcJsonMapper() {}

    static JSONObject toJson(ModelSettings settings) {
        JSONObject json = new JSONObject();
        putIfPresent(json, "asrProvider", settings.asrProvider());
        putIfPresent(json, "asrModel", settings.asrModel());
        putIfPresent(json, "asrPrompt", settings.asrPrompt());
        putIfPresent(json, "llmProvider", settings.llmProvider());
        putIfPresent(json, "llmModel", settings.llmModel());
        putIfPresent(json, "llmTemperature", settings.llmTemperature());
        putIfPresent(json, "transcriptionPrompt", settings.transcriptionPrompt());
        putIfPresent(json, "editingPrompt", settings.editingPrompt());
        putIfPresent(json, "noSpeechThreshold", settings.noSpeechThreshold());
        return json;
    }

    static ModelSettings modelSettings(JSONObject json) {
        JSONObject llm = json.optJSONObject("llm");
        JSONObject src = llm != null ? llm : json;
        return new ModelSettings(
                optString(src, "asrProvider"),
                optString(src, "asrModel"),
                optString(src, "asrPrompt"),
                optString(src, "llmProvider"),
                optString(src, "llmModel"),
                optDouble(src, "llmTemperature"),
                optString(src, "transcriptionPrompt"),
                optString(src, "editingPrompt"),
                optDouble(src, "noSpeechThreshold"));
    }

    static JSONObject toJson(InteractionRecord interaction) {
        JSONObject json = new JSONObject()
                .put("id", interaction.id())
                .put("title", interaction.title())
                .put("asrOutput", interaction.asrOutput())
                .put("rawAudio", Base64.getEncoder().encodeToString(interaction.rawAudio()))
                .put("durationMs", interaction.durationMs())
                .put("sampleRate", interaction.sampleRate())
                .put("createdAt", interaction.createdAt().toString());
        if (interaction.errorMessage() != null) {
            json.put("llmOutput", new JSONObject().put("error", interaction.errorMessage()));
        }
        return json;
    }

    static InteractionRecord interaction(JSONObject json) {
        JSONObject llmOutput = json.optJSONObject("llmOutput");
        String error = llmOutput == null ? null : optString(llmOutput, "error");
        String rawAudio = json.optString("rawAudio", "");
        return new InteractionRecord(
                json.getString("id"),
                json.optString("title", ""),
                json.optString("asrOutput", ""),
                error,
                rawAudio.isEmpty() ? new byte[0] : Base64.getDecoder().decode(rawAudio),
                json.optLong("durationMs", 0L),
                json.optInt("sampleRate", 0),
                optInstant(json, "createdAt", Instant.EPOCH));
    }

    static DictionaryItem dictionaryItem(JSONObject json) {
        return new DictionaryItem(
                json.getString("id"),
                json.optString("word", ""),
                optString(json, "pronunciation"),
                optInstant(json, "updatedAt", null),
                optInstant(json, "deletedAt", null));
    }

    /**
     * Builds an exception from an error object of the form {@code {"code": "...", "message": "..."}}.
     */
    static RpcException toRpcException(String operation, JSONObject error, RpcStatus fallback) {
        RpcStatus status = RpcStatus.fromName(error.optString("code", null));
        return new RpcException(status != null ? status : fallback, operation,
                error.optString("message", "no message"));
    }

    private static void putIfPresent(JSONObject json, String key, Object value) {
        if (value != null) {
            json.put(key, value);
        }
    }

    private static String optString(JSONObject json, String key) {
        if (!json.has(key) || json.isNull(key)) {
            return null;
        }
        String value = json.optString(key, null);
        return (value == null || value.isEmpty()) ? null : value;
    }

    private static Double optDouble(JSONObject json, String key) {
        if (!json.has(key) || json.isNull(key)) {
            return null;
        }
        double value = json.optDouble(key);
        return Double.isNaN(value) ? null : value;
    }

    private static Instant optInstant(JSONObject json, String key, Instant fallback) {
        String value = optString(json, key);
        return value == null ? fallback : Instant.parse(value);
    }
}
