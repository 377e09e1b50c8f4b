package com.phillippitts.speakstream.service.rpc.http;

import com.phillippitts.speakstream.config.transport.TransportProperties;
import com.phillippitts.speakstream.domain.DictionaryItem;
import com.phillippitts.speakstream.domain.InteractionRecord;
import com.phillippitts.speakstream.domain.ModelSettings;
import com.phillippitts.speakstream.exception.RpcException;
import com.phillippitts.speakstream.exception.RpcStatus;
import com.phillippitts.speakstream.exception.StreamCancelledException;
import com.phillippitts.speakstream.service.rpc.CancellationSignal;
import com.phillippitts.speakstream.service.rpc.TranscriptResponse;
import com.phillippitts.speakstream.service.rpc.TranscriptionServiceClient;
import com.phillippitts.speakstream.service.rpc.auth.AuthTokenStore;
import com.phillippitts.speakstream.service.stream.StreamRequest;
import com.phillippitts.speakstream.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * {@link TranscriptionServiceClient} over HTTP using {@link java.net.http.HttpClient}.
 *
 * <p>The streaming call is a single chunked POST whose body is produced lazily from the outbound
 * sequence (see {@link EnvelopeInputStream}); the response body holds the transcript envelope
 * followed by an end-of-stream envelope. Unary calls POST a JSON object to
 * {@code {baseUrl}/{serviceName}/{Method}} and read a JSON object back.
 *
 * <p>Every request carries the current bearer token from {@link AuthTokenStore}.
 */
public class HttpTranscriptionServiceClient implements TranscriptionServiceClient {

    private static final Logger LOG = LogManager.getLogger(HttpTranscriptionServiceClient.class);

    static final String STREAM_CONTENT_TYPE = "application/connect+json";
    static final String JSON_CONTENT_TYPE = "application/json";

    private final TransportProperties props;
    private final AuthTokenStore tokens;
    private final HttpClient httpClient;

    public HttpTranscriptionServiceClient(TransportProperties props, AuthTokenStore tokens, HttpClient httpClient) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.tokens = Objects.requireNonNull(tokens, "tokens must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    @Override
    public TranscriptResponse transcribeStream(Iterable<StreamRequest> requests, CancellationSignal cancellation) {
        Objects.requireNonNull(requests, "requests must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        if (cancellation.isCancelled()) {
            throw new StreamCancelledException("Stream cancelled before it was opened");
        }

        Iterator<StreamRequest> outbound = requests.iterator();
        HttpRequest request = newRequest("TranscribeStream", Duration.ofMillis(props.getStreamTimeoutMs()))
                .version(HttpClient.Version.HTTP_1_1)
                .header("Content-Type", STREAM_CONTENT_TYPE)
                .POST(HttpRequest.BodyPublishers.ofInputStream(
                        () -> new EnvelopeInputStream(outbound, cancellation)))
                .build();

        LOG.debug("Opening transcription stream to {}", request.uri());
        CompletableFuture<HttpResponse<byte[]>> call =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        cancellation.onCancel(() -> call.cancel(true));

        HttpResponse<byte[]> response;
        try {
            response = call.get();
        } catch (CancellationException e) {
            throw new StreamCancelledException("Transcription stream cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new StreamCancelledException("Interrupted while awaiting transcription", e);
        } catch (ExecutionException e) {
            if (cancellation.isCancelled()) {
                throw new StreamCancelledException("Transcription stream cancelled", e.getCause());
            }
            throw transportFailure("transcribeStream", e.getCause());
        }

        LOG.info("Transcription stream status: {}", response.statusCode());
        if (response.statusCode() / 100 != 2) {
            throw httpFailure("transcribeStream", response.statusCode(),
                    new String(response.body(), StandardCharsets.UTF_8));
        }
        return EnvelopeCodec.decodeResponse(response.body());
    }

    @Override
    public InteractionRecord createInteraction(InteractionRecord interaction) {
        JSONObject response = unary("CreateInteraction", RpcJsonMapper.toJson(interaction));
        return RpcJsonMapper.interaction(response);
    }

    @Override
    public InteractionRecord updateInteraction(InteractionRecord interaction) {
        JSONObject response = unary("UpdateInteraction", RpcJsonMapper.toJson(interaction));
        return RpcJsonMapper.interaction(response);
    }

    @Override
    public void deleteInteraction(String interactionId) {
        unary("DeleteInteraction", new JSONObject().put("id", interactionId));
    }

    @Override
    public List<InteractionRecord> listInteractionsSince(Instant since) {
        JSONObject response = unary("ListInteractions", sinceBody(since));
        List<InteractionRecord> result = new ArrayList<>();
        JSONArray items = response.optJSONArray("interactions");
        if (items != null) {
            for (int i = 0; i < items.length(); i++) {
                result.add(RpcJsonMapper.interaction(items.getJSONObject(i)));
            }
        }
        return result;
    }

    @Override
    public List<DictionaryItem> listDictionaryItemsSince(Instant since) {
        JSONObject response = unary("ListDictionaryItems", sinceBody(since));
        List<DictionaryItem> result = new ArrayList<>();
        JSONArray items = response.optJSONArray("items");
        if (items != null) {
            for (int i = 0; i < items.length(); i++) {
                result.add(RpcJsonMapper.dictionaryItem(items.getJSONObject(i)));
            }
        }
        return result;
    }

    @Override
    public ModelSettings getAdvancedSettings() {
        return RpcJsonMapper.modelSettings(unary("GetAdvancedSettings", new JSONObject()));
    }

    private JSONObject sinceBody(Instant since) {
        JSONObject body = new JSONObject();
        if (since != null) {
            body.put("since", since.toString());
        }
        return body;
    }

    private JSONObject unary(String method, JSONObject body) {
        HttpRequest request = newRequest(method, Duration.ofMillis(props.getRequestTimeoutMs()))
                .header("Content-Type", JSON_CONTENT_TYPE)
                .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw transportFailure(method, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException(RpcStatus.CANCELLED, method, "Interrupted", e);
        }
        LOG.debug("{} status: {}", method, response.statusCode());
        if (response.statusCode() / 100 != 2) {
            throw httpFailure(method, response.statusCode(), response.body());
        }
        String responseBody = response.body();
        if (responseBody == null || responseBody.isBlank()) {
            return new JSONObject();
        }
        try {
            return new JSONObject(responseBody);
        } catch (JSONException e) {
            throw new RpcException(RpcStatus.INTERNAL, method, "Malformed response body", e);
        }
    }

    private HttpRequest.Builder newRequest(String method, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(
                        URI.create(props.getBaseUrl() + "/" + props.getServiceName() + "/" + method))
                .timeout(timeout)
                .header("User-Agent", props.getUserAgent())
                .header("Accept", JSON_CONTENT_TYPE);
        tokens.accessToken().ifPresent(token -> builder.header("Authorization", "Bearer " + token));
        return builder;
    }

    /**
     * Maps a non-2xx response to an exception, preferring the status code named in the body.
     */
    static RpcException httpFailure(String operation, int httpStatus, String body) {
        RpcStatus fallback = RpcStatus.fromHttpStatus(httpStatus);
        if (body != null && !body.isBlank()) {
            try {
                JSONObject json = new JSONObject(body);
                JSONObject error = json.optJSONObject("error");
                return RpcJsonMapper.toRpcException(operation, error != null ? error : json, fallback);
            } catch (JSONException e) {
                LOG.debug("{} error body is not JSON: {}", operation, LogSanitizer.truncate(body, 120));
            }
        }
        return new RpcException(fallback, operation, "HTTP " + httpStatus);
    }

    static RpcException transportFailure(String operation, Throwable cause) {
        if (cause instanceof HttpTimeoutException) {
            return new RpcException(RpcStatus.DEADLINE_EXCEEDED, operation, "Timed out", cause);
        }
        if (cause instanceof ConnectException) {
            return new RpcException(RpcStatus.UNAVAILABLE, operation, "Service unreachable", cause);
        }
        if (cause instanceof IOException) {
            return new RpcException(RpcStatus.UNAVAILABLE, operation, String.valueOf(cause.getMessage()), cause);
        }
        return new RpcException(RpcStatus.UNKNOWN, operation, String.valueOf(cause), cause);
    }
}
