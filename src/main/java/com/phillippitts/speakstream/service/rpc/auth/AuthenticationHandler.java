package com.phillippitts.speakstream.service.rpc.auth;

/**
 * Credential collaborator used by the retry policy.
 */
public interface AuthenticationHandler {

    /**
     * Obtains fresh tokens and makes them current for subsequent calls.
     *
     * @return the new tokens
     * @throws com.phillippitts.speakstream.exception.SessionInvalidatedException if the refresh is
     *         rejected or cannot be attempted
     */
    AuthTokens refreshTokens();

    /**
     * Notified once a refresh has failed; the user must sign in again.
     */
    void onAuthInvalidated();
}
