package com.phillippitts.speakstream.service.rpc.auth;

import com.phillippitts.speakstream.config.auth.AuthProperties;
import com.phillippitts.speakstream.exception.SessionInvalidatedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Refreshes credentials with the OAuth refresh-token grant and signs the user out when that fails.
 */
public class OAuthAuthenticationHandler implements AuthenticationHandler {

    private static final Logger LOG = LogManager.getLogger(OAuthAuthenticationHandler.class);

    private final AuthProperties props;
    private final AuthTokenStore store;
    private final ApplicationEventPublisher publisher;
    private final HttpClient httpClient;

    public OAuthAuthenticationHandler(AuthProperties props,
                                      AuthTokenStore store,
                                      ApplicationEventPublisher publisher,
                                      HttpClient httpClient) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    @Override
    public AuthTokens refreshTokens() {
        String refreshToken = store.refreshToken()
                .orElseThrow(() -> new SessionInvalidatedException("No refresh token available"));
        if (props.getTokenEndpoint() == null) {
            throw new SessionInvalidatedException("No token endpoint configured");
        }

        String form = "grant_type=refresh_token"
                + "&refresh_token=" + URLEncoder.encode(refreshToken, StandardCharsets.UTF_8)
                + "&client_id=" + URLEncoder.encode(props.getClientId(), StandardCharsets.UTF_8);
        HttpRequest request = HttpRequest.newBuilder(URI.create(props.getTokenEndpoint()))
                .timeout(Duration.ofMillis(props.getRefreshTimeoutMs()))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(form, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SessionInvalidatedException("Token refresh request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionInvalidatedException("Interrupted during token refresh", e);
        }

        LOG.info("Token refresh status: {}", response.statusCode());
        if (response.statusCode() / 100 != 2) {
            throw new SessionInvalidatedException("Token refresh rejected with HTTP " + response.statusCode());
        }
        AuthTokens tokens = parseTokens(response.body());
        store.update(tokens);
        return tokens;
    }

    @Override
    public void onAuthInvalidated() {
        LOG.warn("Credentials invalidated; signing out");
        store.clear();
        publisher.publishEvent(new AuthInvalidatedEvent("TOKEN_REFRESH_FAILED", Instant.now()));
    }

    static AuthTokens parseTokens(String body) {
        try {
            JSONObject json = new JSONObject(body);
            String accessToken = json.getString("access_token");
            String refreshToken = json.optString("refresh_token", null);
            long expiresIn = json.optLong("expires_in", 0L);
            Instant expiresAt = expiresIn > 0 ? Instant.now().plusSeconds(expiresIn) : null;
            return new AuthTokens(accessToken, refreshToken, expiresAt);
        } catch (JSONException e) {
            throw new SessionInvalidatedException("Malformed token response", e);
        }
    }
}
