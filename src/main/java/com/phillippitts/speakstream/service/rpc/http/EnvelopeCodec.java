package com.phillippitts.speakstream.service.rpc.http;

import com.phillippitts.speakstream.domain.TranscriptionError;
import com.phillippitts.speakstream.exception.RpcException;
import com.phillippitts.speakstream.exception.RpcStatus;
import com.phillippitts.speakstream.service.rpc.TranscriptResponse;
import com.phillippitts.speakstream.service.stream.ConfigSnapshot;
import com.phillippitts.speakstream.service.stream.ControlMessage;
import com.phillippitts.speakstream.service.stream.ModeUpdate;
import com.phillippitts.speakstream.service.stream.StreamRequest;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Length-prefixed JSON envelopes for the streaming call.
 *
 * <p>Each envelope is one flag byte, a 4-byte big-endian payload length, then the UTF-8 JSON
 * payload. Flag {@link #FLAG_END_STREAM} marks the trailing envelope of a response, which carries
 * either nothing or a transport error.
 */
final class EnvelopeCodec {

    static final byte FLAG_DATA = 0x00;
    static final byte FLAG_END_STREAM = 0x02;
    static final int HEADER_LENGTH = 5;

    private EnvelopeCodec() {}

    static byte[] encode(StreamRequest request) {
        return frame(FLAG_DATA, toJson(request).toString().getBytes(StandardCharsets.UTF_8));
    }

    static byte[] frame(byte flag, byte[] payload) {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_LENGTH + payload.length);
        buf.put(flag);
        buf.putInt(payload.length);
        buf.put(payload);
        return buf.array();
    }

    static JSONObject toJson(StreamRequest request) {
        if (request.isAudio()) {
            return new JSONObject().put("audioData",
                    Base64.getEncoder().encodeToString(request.audio().data()));
        }
        return new JSONObject().put("config", configJson(request.control()));
    }

    private static JSONObject configJson(ControlMessage message) {
        if (message instanceof ModeUpdate update) {
            // only the mode; the service merges it onto context it already has
            return new JSONObject().put("context", new JSONObject().put("mode", update.mode().name()));
        }
        if (message instanceof ConfigSnapshot snapshot) {
            JSONObject context = new JSONObject()
                    .put("windowTitle", snapshot.windowTitle())
                    .put("appName", snapshot.appName())
                    .put("contextText", snapshot.selectedText())
                    .put("mode", snapshot.mode().name());
            return new JSONObject()
                    .put("context", context)
                    .put("llmSettings", RpcJsonMapper.toJson(snapshot.modelSettings()))
                    .put("vocabulary", new JSONArray(snapshot.vocabulary()));
        }
        throw new IllegalArgumentException("Unsupported control message: " + message.getClass().getName());
    }

    /**
     * Decodes a complete streaming response body.
     *
     * @throws RpcException when the end-of-stream envelope carries an error or the body is malformed
     */
    static TranscriptResponse decodeResponse(byte[] body) {
        ByteBuffer buf = ByteBuffer.wrap(body);
        TranscriptResponse response = null;
        while (buf.remaining() >= HEADER_LENGTH) {
            byte flag = buf.get();
            int length = buf.getInt();
            if (length < 0 || length > buf.remaining()) {
                throw new RpcException(RpcStatus.INTERNAL, "transcribeStream",
                        "Truncated response envelope (length " + length + ")");
            }
            byte[] payload = new byte[length];
            buf.get(payload);
            String json = new String(payload, StandardCharsets.UTF_8);
            if ((flag & FLAG_END_STREAM) != 0) {
                throwIfError(json);
            } else {
                response = parseTranscript(json);
            }
        }
        if (response == null) {
            throw new RpcException(RpcStatus.INTERNAL, "transcribeStream", "Response contained no transcript");
        }
        return response;
    }

    private static void throwIfError(String json) {
        if (json.isBlank()) {
            return;
        }
        try {
            JSONObject end = new JSONObject(json);
            JSONObject error = end.optJSONObject("error");
            if (error != null) {
                throw RpcJsonMapper.toRpcException("transcribeStream", error, RpcStatus.UNKNOWN);
            }
        } catch (JSONException e) {
            throw new RpcException(RpcStatus.INTERNAL, "transcribeStream", "Malformed end-of-stream envelope", e);
        }
    }

    static TranscriptResponse parseTranscript(String json) {
        try {
            JSONObject obj = new JSONObject(json);
            String transcript = obj.optString("transcript", "");
            JSONObject error = obj.optJSONObject("error");
            TranscriptionError transcriptionError = null;
            if (error != null) {
                transcriptionError = new TranscriptionError(
                        error.optString("code", ""),
                        error.optString("type", ""),
                        error.optString("message", "Transcription failed"),
                        error.optString("provider", ""));
            }
            return new TranscriptResponse(transcript, transcriptionError);
        } catch (JSONException e) {
            throw new RpcException(RpcStatus.INTERNAL, "transcribeStream", "Malformed transcript payload", e);
        }
    }
}
