package com.phillippitts.speakstream.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for dictation sessions and remote calls.
 *
 * <p>Provides:
 * <ul>
 *   <li>Session outcome counts (completed, cancelled, discarded, errored by reason)</li>
 *   <li>Transcript round-trip latency, from end of input to response</li>
 *   <li>Authentication retry and refresh-failure counts</li>
 * </ul>
 */
@Component
public class SessionMetrics {

    private static final String METRIC_PREFIX = "speakstream.session";

    private final MeterRegistry registry;

    public SessionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Increments the outcome counter.
     *
     * @param outcome started, completed, cancelled, discarded or errored
     * @param reason  free-form reason tag, "none" when not applicable
     */
    public void incrementOutcome(String outcome, String reason) {
        Counter.builder(METRIC_PREFIX + ".outcome")
                .description("Dictation sessions by outcome")
                .tag("outcome", outcome)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordTranscriptLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".transcript.latency")
                .description("Time from end of input to transcript")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementAuth(String event) {
        Counter.builder("speakstream.auth")
                .description("Authentication retry events")
                .tag("event", event)
                .register(registry)
                .increment();
    }
}
