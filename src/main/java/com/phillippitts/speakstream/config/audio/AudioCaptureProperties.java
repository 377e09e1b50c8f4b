package com.phillippitts.speakstream.config.audio;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture.
 *
 * Format is 16-bit signed PCM, mono, little-endian. The sample rate is a request; the device may
 * only support another rate, which is then reported to the session.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Size of one delivered frame in milliseconds. */
    @Min(10)
    @Max(200)
    private final int chunkMillis;

    /** Maximum capture duration in milliseconds (hard stop). */
    @Min(100)
    @Max(600_000)
    private final int maxDurationMs;

    /** Requested sample rate in Hz. */
    @Min(8_000)
    @Max(48_000)
    private final int sampleRate;

    /** Optional input device name; falls back to system default when null/blank. */
    private final String deviceName;

    @ConstructorBinding
    public AudioCaptureProperties(Integer chunkMillis,
                                  Integer maxDurationMs,
                                  Integer sampleRate,
                                  String deviceName) {
        this.chunkMillis = chunkMillis == null ? 40 : chunkMillis;
        this.maxDurationMs = maxDurationMs == null ? 300_000 : maxDurationMs;
        this.sampleRate = sampleRate == null ? 16_000 : sampleRate;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    public int getChunkMillis() { return chunkMillis; }
    public int getMaxDurationMs() { return maxDurationMs; }
    public int getSampleRate() { return sampleRate; }
    public String getDeviceName() { return deviceName; }
}
