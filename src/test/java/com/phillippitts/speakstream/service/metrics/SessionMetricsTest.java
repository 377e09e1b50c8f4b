package com.phillippitts.speakstream.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SessionMetricsTest {

    private SimpleMeterRegistry registry;
    private SessionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SessionMetrics(registry);
    }

    @Test
    void countsOutcomesByTag() {
        metrics.incrementOutcome("completed", "none");
        metrics.incrementOutcome("completed", "none");
        metrics.incrementOutcome("discarded", "too_short");

        Counter completed = registry.find("speakstream.session.outcome")
                .tags("outcome", "completed", "reason", "none").counter();
        Counter discarded = registry.find("speakstream.session.outcome")
                .tags("outcome", "discarded", "reason", "too_short").counter();
        assertThat(completed).isNotNull();
        assertThat(completed.count()).isEqualTo(2.0);
        assertThat(discarded.count()).isEqualTo(1.0);
    }

    @Test
    void recordsTranscriptLatency() {
        metrics.recordTranscriptLatency(TimeUnit.MILLISECONDS.toNanos(250));

        Timer timer = registry.find("speakstream.session.transcript.latency").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250.0);
    }

    @Test
    void countsAuthEvents() {
        metrics.incrementAuth("retry_succeeded");
        metrics.incrementAuth("refresh_failed");

        assertThat(registry.find("speakstream.auth").tag("event", "retry_succeeded").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("speakstream.auth").tag("event", "refresh_failed").counter().count())
                .isEqualTo(1.0);
    }
}
