package com.phillippitts.speakstream.service.rpc.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Access and refresh token pair.
 *
 * @param accessToken  bearer token for remote calls
 * @param refreshToken token used to obtain a new access token, may be {@code null}
 * @param expiresAt    access token expiry, or {@code null} when unknown
 */
public record AuthTokens(String accessToken, String refreshToken, Instant expiresAt) {

    public AuthTokens {
        Objects.requireNonNull(accessToken, "accessToken must not be null");
    }

    @Override
    public String toString() {
        return "AuthTokens[expiresAt=" + expiresAt + ", hasRefreshToken=" + (refreshToken != null) + "]";
    }
}
