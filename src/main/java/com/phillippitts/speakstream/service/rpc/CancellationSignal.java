package com.phillippitts.speakstream.service.rpc;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Out-of-band abort for an in-flight remote call.
 *
 * <p>Callbacks registered with {@link #onCancel(Runnable)} run once, on the thread that calls
 * {@link #cancel()}, or immediately when registered after cancellation.
 */
public final class CancellationSignal {

    private static final Logger LOG = LogManager.getLogger(CancellationSignal.class);

    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled;

    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = List.copyOf(callbacks);
            callbacks.clear();
        }
        toRun.forEach(CancellationSignal::runCallback);
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public void onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        runCallback(callback);
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.warn("Cancellation callback failed: {}", e.toString());
        }
    }
}
