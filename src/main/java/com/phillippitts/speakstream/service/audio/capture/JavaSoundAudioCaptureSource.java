package com.phillippitts.speakstream.service.audio.capture;

import com.phillippitts.speakstream.config.audio.AudioCaptureProperties;
import com.phillippitts.speakstream.domain.AudioFrame;
import com.phillippitts.speakstream.service.audio.AudioFormat;
import com.phillippitts.speakstream.util.Timeouts;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Java Sound microphone capture producing PCM16LE mono frames of {@code chunk-millis} each.
 *
 * <p>The configured sample rate is tried first; when the device rejects it, common rates are tried
 * in turn and the rate actually opened is reported through {@link #onConfig(IntConsumer)}.
 * A single daemon thread reads from the line and invokes the frame listener.
 */
public class JavaSoundAudioCaptureSource implements AudioCaptureSource {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioCaptureSource.class);

    private static final int[] FALLBACK_SAMPLE_RATES = {48_000, 44_100, 16_000};

    /** Opens a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;

    private final Object lock = new Object();
    private volatile Consumer<AudioFrame> frameListener = frame -> { };
    private volatile IntConsumer configListener = rate -> { };
    private Capture current;

    public JavaSoundAudioCaptureSource(AudioCaptureProperties props, ApplicationEventPublisher publisher) {
        this(props, publisher, defaultProvider());
    }

    JavaSoundAudioCaptureSource(AudioCaptureProperties props,
                                ApplicationEventPublisher publisher,
                                DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
                if (line == null) {
                    LOG.warn("Input device '{}' not found; using system default", device.get());
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public void onFrame(Consumer<AudioFrame> listener) {
        this.frameListener = Objects.requireNonNull(listener, "listener must not be null");
    }

    @Override
    public void onConfig(IntConsumer sampleRateListener) {
        this.configListener = Objects.requireNonNull(sampleRateListener, "sampleRateListener must not be null");
    }

    @Override
    public void start(String deviceId) {
        synchronized (lock) {
            if (current != null && current.active.get()) {
                throw new IllegalStateException("Capture is already running");
            }
            String device = (deviceId == null || deviceId.isBlank()) ? props.getDeviceName() : deviceId;
            Capture capture = new Capture(device);
            capture.active.set(true);
            Thread t = new Thread(() -> doCapture(capture), "audio-capture");
            t.setDaemon(true);
            capture.thread = t;
            current = capture;
            t.start();
            LOG.debug("Capture started (device='{}')", device == null ? "default" : device);
        }
    }

    @Override
    public void stop() {
        Thread captureThread;
        synchronized (lock) {
            if (current == null) {
                return;
            }
            current.active.set(false);
            captureThread = current.thread;
            current = null;
        }
        // join outside the lock so the final frame can be delivered
        joinThread(captureThread, Timeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
    }

    @Override
    public boolean isCapturing() {
        synchronized (lock) {
            return current != null && current.active.get();
        }
    }

    @PreDestroy
    public void shutdown() {
        Thread captureThread = null;
        synchronized (lock) {
            if (current != null) {
                LOG.info("Shutting down with active capture; forcing stop");
                current.active.set(false);
                captureThread = current.thread;
                current = null;
            }
        }
        if (captureThread != null) {
            joinThread(captureThread, Timeouts.CAPTURE_THREAD_SHUTDOWN_TIMEOUT.toMillis());
        }
    }

    private void doCapture(Capture capture) {
        TargetDataLine line = null;
        try {
            line = openLine(capture.device);
            int sampleRate = Math.round(line.getFormat().getSampleRate());
            configListener.accept(sampleRate);
            line.start();

            int bytesPerChunk = AudioFormat.bytesFor(props.getChunkMillis(), sampleRate);
            long hardStopBytes = (long) AudioFormat.bytesFor(props.getMaxDurationMs(), sampleRate);
            byte[] buf = new byte[bytesPerChunk];
            long written = 0;
            while (capture.active.get()) {
                int n = line.read(buf, 0, buf.length);
                if (n <= 0) {
                    continue;
                }
                frameListener.accept(new AudioFrame(Arrays.copyOf(buf, n), sampleRate));
                written += n;
                if (written >= hardStopBytes) {
                    LOG.info("Max capture duration reached ({} ms)", props.getMaxDurationMs());
                    capture.active.set(false);
                }
            }
            LOG.info("Audio capture completed: {} bytes at {} Hz", written, sampleRate);
        } catch (LineUnavailableException e) {
            LOG.warn("Microphone unavailable: {}", e.getMessage());
            publisher.publishEvent(new CaptureErrorEvent("MIC_UNAVAILABLE", Instant.now()));
        } catch (SecurityException se) {
            LOG.warn("Microphone access denied: {}", se.getMessage());
            publisher.publishEvent(new CaptureErrorEvent("MIC_PERMISSION_DENIED", Instant.now()));
        } catch (RuntimeException e) {
            LOG.warn("Capture failed: {}", e.toString());
            publisher.publishEvent(new CaptureErrorEvent("CAPTURE_ERROR", Instant.now()));
        } finally {
            capture.active.set(false);
            if (line != null) {
                closeLine(line);
            }
        }
    }

    private TargetDataLine openLine(String device) throws LineUnavailableException {
        Set<Integer> rates = new LinkedHashSet<>();
        rates.add(props.getSampleRate());
        for (int rate : FALLBACK_SAMPLE_RATES) {
            rates.add(rate);
        }
        IllegalArgumentException unsupported = null;
        for (int rate : rates) {
            try {
                return provider.open(format(rate), Optional.ofNullable(device));
            } catch (IllegalArgumentException e) {
                LOG.debug("Sample rate {} not supported: {}", rate, e.getMessage());
                unsupported = e;
            }
        }
        throw new LineUnavailableException("No supported sample rate: " + unsupported.getMessage());
    }

    static javax.sound.sampled.AudioFormat format(int sampleRate) {
        return new javax.sound.sampled.AudioFormat(
                sampleRate,
                AudioFormat.BITS_PER_SAMPLE,
                AudioFormat.CHANNELS,
                AudioFormat.SIGNED,
                AudioFormat.BIG_ENDIAN);
    }

    private void closeLine(TargetDataLine line) {
        try {
            line.stop();
            line.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing capture line: {}", e.toString());
        }
    }

    private void joinThread(Thread thread, long timeoutMs) {
        if (thread == null || !thread.isAlive()) {
            return;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }

    private static final class Capture {
        final String device;
        final AtomicBoolean active = new AtomicBoolean(false);
        volatile Thread thread;

        Capture(String device) {
            this.device = device;
        }
    }
}
