package com.phillippitts.speakstream.service.stream;

import com.phillippitts.speakstream.domain.AudioFrame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Merges the audio drain and the control queue into the single outbound sequence.
 *
 * <p>For each frame pulled from the audio source, every control message pending at that
 * moment is emitted first (FIFO), then the frame. When the audio source ends, any control
 * messages still pending are emitted. Once the cancellation flag is observed no further
 * item is emitted.
 *
 * <p>Stepped by a single consumer thread; {@link #hasNext()} blocks while the audio source
 * is waiting for frames.
 */
final class OutboundStreamMerger implements Iterator<StreamRequest> {

    private static final Logger LOG = LogManager.getLogger(OutboundStreamMerger.class);

    private enum Phase { FRAMES, TAIL, DONE }

    private final Iterator<AudioFrame> frames;
    private final ControlMessageQueue controls;
    private final BooleanSupplier cancelled;
    private final Deque<StreamRequest> ready = new ArrayDeque<>();
    private Phase phase = Phase.FRAMES;
    private long emittedFrames;
    private long emittedControls;

    OutboundStreamMerger(Iterator<AudioFrame> frames, ControlMessageQueue controls, BooleanSupplier cancelled) {
        this.frames = Objects.requireNonNull(frames, "frames must not be null");
        this.controls = Objects.requireNonNull(controls, "controls must not be null");
        this.cancelled = Objects.requireNonNull(cancelled, "cancelled must not be null");
    }

    @Override
    public boolean hasNext() {
        while (true) {
            if (phase != Phase.DONE && cancelled.getAsBoolean()) {
                LOG.debug("Cancellation observed; stopping outbound stream after {} frames", emittedFrames);
                ready.clear();
                phase = Phase.DONE;
            }
            if (!ready.isEmpty()) {
                return true;
            }
            switch (phase) {
                case FRAMES -> step();
                case TAIL -> {
                    enqueuePendingControls();
                    phase = Phase.DONE;
                }
                case DONE -> {
                    return false;
                }
            }
        }
    }

    @Override
    public StreamRequest next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Outbound stream has ended");
        }
        StreamRequest request = ready.pollFirst();
        if (request.isAudio()) {
            emittedFrames++;
        } else {
            emittedControls++;
        }
        return request;
    }

    private void step() {
        if (!frames.hasNext()) {
            LOG.debug("Audio source ended after {} frames and {} control messages", emittedFrames, emittedControls);
            phase = Phase.TAIL;
            return;
        }
        AudioFrame frame = frames.next();
        if (cancelled.getAsBoolean()) {
            return;
        }
        enqueuePendingControls();
        ready.addLast(StreamRequest.audio(frame));
    }

    private void enqueuePendingControls() {
        for (ControlMessage message : controls.drainPending()) {
            ready.addLast(StreamRequest.control(message));
        }
    }
}
