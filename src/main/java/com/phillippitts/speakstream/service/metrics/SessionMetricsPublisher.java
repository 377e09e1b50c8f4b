package com.phillippitts.speakstream.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Records session and authentication metrics, tolerating a missing {@link SessionMetrics}.
 *
 * <p>{@link #NOOP} is used by tests and by components constructed without metrics.
 */
@Component
public final class SessionMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(SessionMetricsPublisher.class);

    /** Publisher that records nothing. */
    public static final SessionMetricsPublisher NOOP = new SessionMetricsPublisher(null);

    private final SessionMetrics metrics;

    public SessionMetricsPublisher(SessionMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("SessionMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordStarted() {
        outcome("started", "none");
    }

    public void recordCompleted(long latencyNanos) {
        if (metrics == null) {
            return;
        }
        metrics.incrementOutcome("completed", "none");
        metrics.recordTranscriptLatency(latencyNanos);
    }

    public void recordCancelled() {
        outcome("cancelled", "none");
    }

    /** A session shorter than the minimum utterance length was discarded. */
    public void recordDiscarded() {
        outcome("discarded", "too_short");
    }

    /**
     * @param reason remote_error, transport_error or auth_invalidated
     */
    public void recordErrored(String reason) {
        outcome("errored", reason);
    }

    public void recordAuthRetry(boolean succeeded) {
        if (metrics != null) {
            metrics.incrementAuth(succeeded ? "retry_succeeded" : "retry_failed");
        }
    }

    public void recordAuthRefreshFailure() {
        if (metrics != null) {
            metrics.incrementAuth("refresh_failed");
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }

    private void outcome(String outcome, String reason) {
        if (metrics != null) {
            metrics.incrementOutcome(outcome, reason);
        }
    }
}
