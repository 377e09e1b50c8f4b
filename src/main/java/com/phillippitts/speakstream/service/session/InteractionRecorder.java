package com.phillippitts.speakstream.service.session;

/**
 * Persists the history entry for a finished dictation attempt.
 *
 * <p>Implementations log failures instead of throwing; persistence never affects the session.
 */
public interface InteractionRecorder {

    /**
     * @param transcript   text returned by the service, possibly empty
     * @param audio        PCM16LE audio of the attempt
     * @param sampleRate   sample rate of {@code audio}
     * @param errorMessage failure message, or {@code null} for a successful attempt
     */
    void createInteraction(String transcript, byte[] audio, int sampleRate, String errorMessage);
}
