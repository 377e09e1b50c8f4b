package com.phillippitts.speakstream.config.auth;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for credential refresh.
 *
 * <p>The initial tokens are normally produced by the sign-in flow; {@code access-token} and
 * {@code refresh-token} allow seeding them for headless runs.
 */
@Validated
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    /** OAuth token endpoint used for the refresh-token grant. Blank disables refresh. */
    private final String tokenEndpoint;

    /** OAuth client id sent with refresh requests. */
    private final String clientId;

    @Min(500)
    @Max(60_000)
    private final int refreshTimeoutMs;

    private final String accessToken;
    private final String refreshToken;

    @ConstructorBinding
    public AuthProperties(String tokenEndpoint,
                          String clientId,
                          Integer refreshTimeoutMs,
                          String accessToken,
                          String refreshToken) {
        this.tokenEndpoint = blankToNull(tokenEndpoint);
        this.clientId = clientId == null ? "" : clientId;
        this.refreshTimeoutMs = refreshTimeoutMs == null ? 10_000 : refreshTimeoutMs;
        this.accessToken = blankToNull(accessToken);
        this.refreshToken = blankToNull(refreshToken);
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value;
    }

    public String getTokenEndpoint() { return tokenEndpoint; }
    public String getClientId() { return clientId; }
    public int getRefreshTimeoutMs() { return refreshTimeoutMs; }
    public String getAccessToken() { return accessToken; }
    public String getRefreshToken() { return refreshToken; }
}
