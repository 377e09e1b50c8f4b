package com.phillippitts.speakstream.presentation.exception;

import com.phillippitts.speakstream.exception.RpcException;
import com.phillippitts.speakstream.exception.RpcStatus;
import com.phillippitts.speakstream.exception.SessionInvalidatedException;
import com.phillippitts.speakstream.exception.SessionStateException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void sessionStateMapsToConflict() {
        ResponseEntity<?> response = handler.handleSessionState(
                new SessionStateException("A session is already active", "STREAMING"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().toString()).contains("state=STREAMING");
    }

    @Test
    void invalidatedSessionMapsToUnauthorized() {
        ResponseEntity<?> response = handler.handleSessionInvalidated(
                new SessionInvalidatedException("refresh rejected"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody().toString()).contains("Sign-in required");
    }

    @Test
    void unavailableServiceMapsTo503() {
        ResponseEntity<?> response = handler.handleRpc(
                new RpcException(RpcStatus.UNAVAILABLE, "TranscribeStream", "connection refused"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).contains("TranscribeStream");
    }

    @Test
    void otherRemoteFailuresMapTo502() {
        ResponseEntity<?> response = handler.handleRpc(
                new RpcException(RpcStatus.INTERNAL, "CreateInteraction", "server error"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    }

    @Test
    void illegalArgumentMapsToBadRequest() {
        ResponseEntity<?> response = handler.handleBadRequest(new IllegalArgumentException("bad mode"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("bad mode");
    }

    @Test
    void unexpectedErrorHidesDetails() {
        ResponseEntity<?> response = handler.handleUnexpected(new RuntimeException("secret transcript"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).doesNotContain("secret transcript");
    }
}
