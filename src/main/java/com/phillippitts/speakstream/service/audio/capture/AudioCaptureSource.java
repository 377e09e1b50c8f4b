package com.phillippitts.speakstream.service.audio.capture;

import com.phillippitts.speakstream.domain.AudioFrame;

import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Microphone capture that delivers audio as a sequence of frames.
 *
 * <p>Listeners are invoked on the capture thread and must not block.
 */
public interface AudioCaptureSource {

    /** Registers the listener receiving each captured frame. Replaces any previous listener. */
    void onFrame(Consumer<AudioFrame> listener);

    /** Registers the listener receiving the effective sample rate once the device is open. */
    void onConfig(IntConsumer sampleRateListener);

    /**
     * Starts capturing.
     *
     * @param deviceId input device name, or {@code null} for the configured/default device
     * @throws IllegalStateException if capture is already running
     */
    void start(String deviceId);

    /**
     * Stops capturing and returns once the last frame has been delivered. Idempotent.
     */
    void stop();

    boolean isCapturing();
}
