package com.phillippitts.speakstream.service.rpc.auth;

import com.phillippitts.speakstream.config.auth.AuthProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory holder for the current credentials. Read on every remote call.
 */
@Component
public class AuthTokenStore {

    private static final Logger LOG = LogManager.getLogger(AuthTokenStore.class);

    private final AtomicReference<AuthTokens> current = new AtomicReference<>();

    public AuthTokenStore() {
    }

    @Autowired
    public AuthTokenStore(AuthProperties props) {
        if (props.getAccessToken() != null) {
            current.set(new AuthTokens(props.getAccessToken(), props.getRefreshToken(), null));
            LOG.info("Seeded credentials from configuration");
        }
    }

    public Optional<AuthTokens> get() {
        return Optional.ofNullable(current.get());
    }

    public Optional<String> accessToken() {
        return get().map(AuthTokens::accessToken);
    }

    public Optional<String> refreshToken() {
        return get().map(AuthTokens::refreshToken);
    }

    public boolean hasCredentials() {
        return current.get() != null;
    }

    public void update(AuthTokens tokens) {
        AuthTokens previous = current.get();
        // keep the refresh token when the server does not rotate it
        if (tokens.refreshToken() == null && previous != null && previous.refreshToken() != null) {
            tokens = new AuthTokens(tokens.accessToken(), previous.refreshToken(), tokens.expiresAt());
        }
        current.set(tokens);
    }

    public void clear() {
        current.set(null);
    }
}
