package com.phillippitts.speakstream.testutil;

import com.phillippitts.speakstream.domain.AudioFrame;
import com.phillippitts.speakstream.service.audio.AudioFormat;
import com.phillippitts.speakstream.service.audio.capture.AudioCaptureSource;

import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Capture source driven by the test: {@link #emit(int)} delivers silence of a given length.
 *
 * <p>{@link #start} reports {@link #sampleRate} through the config listener like a real device.
 */
public class FakeAudioCaptureSource implements AudioCaptureSource {

    public volatile int sampleRate = AudioFormat.DEFAULT_SAMPLE_RATE;
    public volatile RuntimeException startFailure;
    public volatile String startedWith;
    public volatile int startCount;
    public volatile int stopCount;

    private volatile Consumer<AudioFrame> frameListener = f -> { };
    private volatile IntConsumer configListener = r -> { };
    private volatile boolean capturing;

    @Override
    public void onFrame(Consumer<AudioFrame> listener) {
        this.frameListener = listener;
    }

    @Override
    public void onConfig(IntConsumer sampleRateListener) {
        this.configListener = sampleRateListener;
    }

    @Override
    public void start(String deviceId) {
        if (startFailure != null) {
            throw startFailure;
        }
        startCount++;
        startedWith = deviceId;
        capturing = true;
        configListener.accept(sampleRate);
    }

    @Override
    public void stop() {
        stopCount++;
        capturing = false;
    }

    @Override
    public boolean isCapturing() {
        return capturing;
    }

    /** Delivers {@code millis} of silence as one frame. */
    public void emit(int millis) {
        emitBytes(new byte[AudioFormat.bytesFor(millis, sampleRate)]);
    }

    public void emitBytes(byte[] pcm) {
        frameListener.accept(new AudioFrame(pcm, sampleRate));
    }
}
