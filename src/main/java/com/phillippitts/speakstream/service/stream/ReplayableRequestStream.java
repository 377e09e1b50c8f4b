package com.phillippitts.speakstream.service.stream;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Makes a single-pass outbound sequence safe to send more than once.
 *
 * <p>Every item pulled from the live source is recorded. Each call to {@link #iterator()}
 * starts a new attempt that first replays the recorded items in order and then continues
 * with live items. Starting a new attempt retires the previous one: its iterator ends at the
 * next {@code hasNext()} so two transport attempts never consume the live source together.
 */
public final class ReplayableRequestStream implements Iterable<StreamRequest> {

    private final Iterator<StreamRequest> live;
    private final List<StreamRequest> recorded = new ArrayList<>();
    private final Object recordLock = new Object();
    private final Lock pullLock = new ReentrantLock();
    private volatile int currentAttempt;

    public ReplayableRequestStream(Iterator<StreamRequest> live) {
        this.live = Objects.requireNonNull(live, "live must not be null");
    }

    @Override
    public Iterator<StreamRequest> iterator() {
        int attempt;
        synchronized (recordLock) {
            attempt = ++currentAttempt;
        }
        return new AttemptIterator(attempt);
    }

    /** Number of items pulled from the live source so far. */
    public int recordedCount() {
        synchronized (recordLock) {
            return recorded.size();
        }
    }

    private StreamRequest recordedAt(int index) {
        synchronized (recordLock) {
            return index < recorded.size() ? recorded.get(index) : null;
        }
    }

    private final class AttemptIterator implements Iterator<StreamRequest> {

        private final int attempt;
        private int position;
        private StreamRequest next;

        AttemptIterator(int attempt) {
            this.attempt = attempt;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (attempt != currentAttempt) {
                return false;
            }
            next = recordedAt(position);
            if (next == null) {
                next = pullLive();
            }
            if (next != null) {
                position++;
            }
            return next != null;
        }

        @Override
        public StreamRequest next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Request stream has ended");
            }
            StreamRequest request = next;
            next = null;
            return request;
        }

        private StreamRequest pullLive() {
            pullLock.lock();
            try {
                // another attempt may have pulled while this one waited for the lock
                StreamRequest alreadyPulled = recordedAt(position);
                if (alreadyPulled != null) {
                    return alreadyPulled;
                }
                if (attempt != currentAttempt || !live.hasNext()) {
                    return null;
                }
                StreamRequest pulled = live.next();
                synchronized (recordLock) {
                    recorded.add(pulled);
                }
                return pulled;
            } finally {
                pullLock.unlock();
            }
        }
    }
}
