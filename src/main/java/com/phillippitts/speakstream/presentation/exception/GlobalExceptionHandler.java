package com.phillippitts.speakstream.presentation.exception;

import com.phillippitts.speakstream.exception.RpcException;
import com.phillippitts.speakstream.exception.SessionInvalidatedException;
import com.phillippitts.speakstream.exception.SessionStateException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Global exception handler for the local control API.
 *
 * Converts domain exceptions to HTTP responses; transcript text never appears in a response.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Operation not allowed in the current session state (HTTP 409).
     */
    @ExceptionHandler(SessionStateException.class)
    ResponseEntity<ApiError> handleSessionState(SessionStateException ex) {
        LOG.debug("Rejected session request in state {}: {}", ex.getState(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                ex.getMessage(),
                "state=" + ex.getState(),
                Instant.now()
            ));
    }

    /**
     * Credentials could not be refreshed; the user must sign in again (HTTP 401).
     */
    @ExceptionHandler(SessionInvalidatedException.class)
    ResponseEntity<ApiError> handleSessionInvalidated(SessionInvalidatedException ex) {
        LOG.warn("Request failed with invalid credentials: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.UNAUTHORIZED)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Sign-in required",
                "Credentials expired and could not be refreshed",
                Instant.now()
            ));
    }

    /**
     * Remote service failure (HTTP 502, or 503 when unreachable).
     */
    @ExceptionHandler(RpcException.class)
    ResponseEntity<ApiError> handleRpc(RpcException ex) {
        LOG.error("Remote call {} failed: {}", ex.getOperation(), ex.getStatus());
        HttpStatus status = switch (ex.getStatus()) {
            case UNAVAILABLE, DEADLINE_EXCEEDED -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity
            .status(status)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Transcription service call failed",
                ex.getOperation() + " [" + ex.getStatus() + "]",
                Instant.now()
            ));
    }

    /**
     * Client error - bad or missing parameter (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "See application log for the request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
