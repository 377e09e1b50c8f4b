package com.phillippitts.speakstream.service.rpc.auth;

import com.phillippitts.speakstream.config.auth.AuthProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AuthTokenStoreTest {

    @Test
    void seedsCredentialsFromConfiguration() {
        AuthTokenStore store = new AuthTokenStore(new AuthProperties(null, null, null, "seed-access", "seed-refresh"));

        assertThat(store.accessToken()).contains("seed-access");
        assertThat(store.refreshToken()).contains("seed-refresh");
    }

    @Test
    void emptyWithoutConfiguredToken() {
        AuthTokenStore store = new AuthTokenStore(new AuthProperties(null, null, null, " ", null));

        assertThat(store.hasCredentials()).isFalse();
        assertThat(store.accessToken()).isEmpty();
    }

    @Test
    void keepsRefreshTokenWhenNotRotated() {
        AuthTokenStore store = new AuthTokenStore();
        store.update(new AuthTokens("a1", "r1", null));

        store.update(new AuthTokens("a2", null, null));

        assertThat(store.accessToken()).contains("a2");
        assertThat(store.refreshToken()).contains("r1");
    }

    @Test
    void clearRemovesCredentials() {
        AuthTokenStore store = new AuthTokenStore();
        store.update(new AuthTokens("a1", "r1", null));

        store.clear();

        assertThat(store.hasCredentials()).isFalse();
    }
}
