package com.phillippitts.speakstream.service.audio;

import com.phillippitts.speakstream.domain.AudioFrame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Buffer between the audio capture callback (producer) and the outbound stream (single consumer).
 *
 * <p>Every accepted frame goes to two places: the outgoing queue that {@link #drain()} empties,
 * and the retained {@link BufferedAudio} that keeps the whole interaction for persistence and
 * duration math. The queue is opened by {@link #open()} and closed by {@link #close()};
 * frames pushed while it is closed are dropped from both.
 *
 * <p><b>Thread Safety:</b> {@link #push(AudioFrame)} never blocks on the consumer. Only one
 * thread may iterate {@link #drain()} at a time; that thread parks on a {@link Condition}
 * while the queue is empty and open, and is woken by the next push or by close.
 */
public final class AudioBufferQueue {

    private static final Logger LOG = LogManager.getLogger(AudioBufferQueue.class);

    private final Lock lock = new ReentrantLock();
    private final Condition frameAvailable = lock.newCondition();
    private final Deque<AudioFrame> pending = new ArrayDeque<>();
    private final BufferedAudio retained = new BufferedAudio();

    private boolean open;
    private long bufferedBytes;
    private volatile int sampleRate = AudioFormat.DEFAULT_SAMPLE_RATE;

    /**
     * Starts a new interaction: discards queued frames, retained audio and the byte count,
     * resets the sample rate to {@link AudioFormat#DEFAULT_SAMPLE_RATE}, then accepts pushes.
     */
    public void open() {
        lock.lock();
        try {
            pending.clear();
            retained.clear();
            bufferedBytes = 0;
            sampleRate = AudioFormat.DEFAULT_SAMPLE_RATE;
            open = true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Accepts a frame for streaming and retention, then wakes the waiting consumer.
     * A no-op when the queue is not open.
     */
    public void push(AudioFrame frame) {
        Objects.requireNonNull(frame, "frame must not be null");
        lock.lock();
        try {
            if (!open) {
                LOG.trace("Dropping {} bytes pushed while queue is closed", frame.length());
                return;
            }
            pending.addLast(frame);
            retained.append(frame.data());
            bufferedBytes += frame.length();
            frameAvailable.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting frames and wakes the consumer so the drain sequence can finish once
     * the remaining frames are consumed. Idempotent.
     */
    public void close() {
        lock.lock();
        try {
            open = false;
            frameAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isOpen() {
        lock.lock();
        try {
            return open;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a lazy sequence of frames. {@code hasNext()} blocks while the queue is empty and
     * still open; it returns {@code false} once the queue is closed and empty. If the consuming
     * thread is interrupted while waiting, the interrupt flag is restored and the sequence ends.
     */
    public Iterator<AudioFrame> drain() {
        return new Iterator<>() {
            private AudioFrame next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    next = awaitNext();
                }
                return next != null;
            }

            @Override
            public AudioFrame next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("Audio stream has ended");
                }
                AudioFrame frame = next;
                next = null;
                return frame;
            }
        };
    }

    private AudioFrame awaitNext() {
        lock.lock();
        try {
            while (pending.isEmpty()) {
                if (!open) {
                    return null;
                }
                frameAvailable.await();
            }
            return pending.pollFirst();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Interrupted while waiting for audio; ending drain");
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Updates the sample rate used for duration math. Non-positive values are ignored.
     */
    public void setSampleRate(int sampleRate) {
        if (sampleRate <= 0) {
            LOG.debug("Ignoring invalid sample rate {}", sampleRate);
            return;
        }
        this.sampleRate = sampleRate;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    /** Total bytes accepted since the last {@link #open()}. */
    public long getBufferedBytes() {
        lock.lock();
        try {
            return bufferedBytes;
        } finally {
            lock.unlock();
        }
    }

    /** Duration of the accepted audio, floored to milliseconds. */
    public long getBufferedDurationMs() {
        return AudioFormat.durationMs(getBufferedBytes(), sampleRate);
    }

    /** Concatenation of all frames accepted since the last {@link #open()}. */
    public byte[] getBufferedAudio() {
        return retained.toByteArray();
    }

    /** Normalized RMS energy (0..1) of the accepted audio. */
    public double getBufferedEnergy() {
        return retained.energy();
    }
}
