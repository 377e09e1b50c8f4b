package com.phillippitts.speakstream.exception;

import java.util.Objects;

/**
 * Thrown when a call to the remote transcription service fails.
 *
 * <p>The {@link RpcStatus} classifies the failure; {@link #isUnauthenticated()} is what the
 * auth-retry policy keys off.
 */
public class RpcException extends SpeakStreamException {

    private final RpcStatus status;
    private final String operation;

    public RpcException(RpcStatus status, String operation, String message) {
        super(format(status, operation, message));
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.operation = operation == null ? "unknown" : operation;
    }

    public RpcException(RpcStatus status, String operation, String message, Throwable cause) {
        super(format(status, operation, message), cause);
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.operation = operation == null ? "unknown" : operation;
    }

    public RpcStatus getStatus() {
        return status;
    }

    public String getOperation() {
        return operation;
    }

    public boolean isUnauthenticated() {
        return status == RpcStatus.UNAUTHENTICATED;
    }

    private static String format(RpcStatus status, String operation, String message) {
        return operation + " failed [" + status + "]: " + message;
    }
}
