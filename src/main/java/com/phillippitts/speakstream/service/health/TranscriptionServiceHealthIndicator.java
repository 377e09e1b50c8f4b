package com.phillippitts.speakstream.service.health;

import com.phillippitts.speakstream.config.transport.TransportProperties;
import com.phillippitts.speakstream.service.rpc.auth.AuthTokenStore;
import com.phillippitts.speakstream.service.stream.StreamSessionController;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether dictation can reach the transcription service.
 *
 * <ul>
 *   <li>UP: credentials present</li>
 *   <li>UNAUTHENTICATED: no credentials; the user must sign in</li>
 * </ul>
 * Exposed via /actuator/health together with the current session state.
 */
@Component
public class TranscriptionServiceHealthIndicator implements HealthIndicator {

    private final AuthTokenStore tokenStore;
    private final StreamSessionController controller;
    private final TransportProperties transport;

    public TranscriptionServiceHealthIndicator(AuthTokenStore tokenStore,
                                               StreamSessionController controller,
                                               TransportProperties transport) {
        this.tokenStore = tokenStore;
        this.controller = controller;
        this.transport = transport;
    }

    @Override
    public Health health() {
        Health.Builder builder = tokenStore.hasCredentials()
                ? Health.up()
                : Health.status("UNAUTHENTICATED");
        return builder
                .withDetail("endpoint", String.valueOf(transport.getBaseUrl()))
                .withDetail("credentials", tokenStore.hasCredentials())
                .withDetail("sessionState", controller.getState().name())
                .build();
    }
}
