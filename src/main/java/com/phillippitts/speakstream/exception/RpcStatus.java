package com.phillippitts.speakstream.exception;

import java.net.HttpURLConnection;

/**
 * Status codes for failed remote calls, named after the canonical RPC codes so that
 * errors read the same regardless of the transport that produced them.
 */
public enum RpcStatus {
    CANCELLED,
    UNKNOWN,
    INVALID_ARGUMENT,
    DEADLINE_EXCEEDED,
    NOT_FOUND,
    PERMISSION_DENIED,
    UNAUTHENTICATED,
    UNAVAILABLE,
    INTERNAL;

    /**
     * Maps an HTTP response status to an RPC status.
     *
     * @param httpStatus HTTP status code (non-2xx)
     * @return matching status, {@link #UNKNOWN} for unmapped codes
     */
    public static RpcStatus fromHttpStatus(int httpStatus) {
        return switch (httpStatus) {
            case HttpURLConnection.HTTP_BAD_REQUEST -> INVALID_ARGUMENT;
            case HttpURLConnection.HTTP_UNAUTHORIZED -> UNAUTHENTICATED;
            case HttpURLConnection.HTTP_FORBIDDEN -> PERMISSION_DENIED;
            case HttpURLConnection.HTTP_NOT_FOUND -> NOT_FOUND;
            case HttpURLConnection.HTTP_CLIENT_TIMEOUT, HttpURLConnection.HTTP_GATEWAY_TIMEOUT -> DEADLINE_EXCEEDED;
            case HttpURLConnection.HTTP_UNAVAILABLE -> UNAVAILABLE;
            case 499 -> CANCELLED;
            default -> httpStatus >= 500 ? INTERNAL : UNKNOWN;
        };
    }

    /**
     * Parses a status name as sent in an error body ({@code "unauthenticated"},
     * {@code "UNAVAILABLE"}, ...).
     *
     * @return matching status, or {@code null} when the name is not recognized
     */
    public static RpcStatus fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        try {
            return RpcStatus.valueOf(name.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
