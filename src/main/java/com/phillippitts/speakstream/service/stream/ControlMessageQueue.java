package com.phillippitts.speakstream.service.stream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * FIFO of pending control messages. Polled opportunistically by the stream merger;
 * nobody ever waits on it.
 */
public final class ControlMessageQueue {

    private final Deque<ControlMessage> pending = new ArrayDeque<>();

    public synchronized void enqueue(ControlMessage message) {
        pending.addLast(Objects.requireNonNull(message, "message must not be null"));
    }

    /**
     * Atomically removes and returns every queued message in FIFO order.
     *
     * @return drained messages, empty when nothing is pending
     */
    public synchronized List<ControlMessage> drainPending() {
        if (pending.isEmpty()) {
            return List.of();
        }
        List<ControlMessage> drained = new ArrayList<>(pending);
        pending.clear();
        return drained;
    }

    public synchronized void clear() {
        pending.clear();
    }

    public synchronized int size() {
        return pending.size();
    }
}
