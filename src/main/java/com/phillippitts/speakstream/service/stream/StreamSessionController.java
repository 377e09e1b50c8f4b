package com.phillippitts.speakstream.service.stream;

import com.phillippitts.speakstream.domain.AudioFrame;
import com.phillippitts.speakstream.domain.ContextSnapshot;
import com.phillippitts.speakstream.domain.DictationMode;
import com.phillippitts.speakstream.domain.TranscriptResult;
import com.phillippitts.speakstream.exception.SessionStateException;
import com.phillippitts.speakstream.exception.StreamCancelledException;
import com.phillippitts.speakstream.service.audio.AudioBufferQueue;
import com.phillippitts.speakstream.service.audio.AudioFormat;
import com.phillippitts.speakstream.service.context.ContextProvider;
import com.phillippitts.speakstream.service.rpc.CancellationSignal;
import com.phillippitts.speakstream.service.rpc.TranscriptResponse;
import com.phillippitts.speakstream.service.rpc.TranscriptionServiceClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single streaming session and drives the outbound stream to the transcription service.
 *
 * <p>Audio frames from the capture source and control messages from the session layer are merged
 * into one outbound sequence by an {@link OutboundStreamMerger}: control messages pending when a
 * frame is pulled are sent ahead of that frame, and whatever is still pending when audio ends is
 * sent last. The remote call runs on {@code streamExecutor}; {@link #startRpc()} returns a future
 * completed with the {@link TranscriptResult}.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE/terminal → INITIALIZED (initialize)
 * INITIALIZED → STREAMING (startRpc)
 * STREAMING → ENDING (endInteraction)
 * ENDING/STREAMING → COMPLETED | ERRORED (remote call finishes)
 * INITIALIZED/STREAMING/ENDING → CANCELLED (cancel)
 * </pre>
 * Only one session may be active (INITIALIZED, STREAMING or ENDING) at a time.
 *
 * <p>Each {@link #initialize} creates a fresh {@link Session} with its own audio queue, control
 * queue and cancel flag. A stream thread only ever reads the session it was started for, so a
 * cancelled session that is still winding down cannot consume frames of the next one.
 *
 * <p><b>Thread Safety:</b> lifecycle operations are serialized by a lock. {@link #onAudioFrame}
 * is called from the capture thread and never blocks on the consumer.
 */
public class StreamSessionController {

    private static final Logger LOG = LogManager.getLogger(StreamSessionController.class);

    private final TranscriptionServiceClient rpcClient;
    private final ContextProvider contextProvider;
    private final Executor streamExecutor;

    private final Lock lock = new ReentrantLock();

    private SessionState state = SessionState.IDLE;
    private DictationMode mode = DictationMode.TRANSCRIBE;
    // replaced on initialize; read without the lock by the capture callbacks
    private volatile Session current;

    public StreamSessionController(TranscriptionServiceClient rpcClient,
                                   ContextProvider contextProvider,
                                   Executor streamExecutor) {
        this.rpcClient = Objects.requireNonNull(rpcClient, "rpcClient must not be null");
        this.contextProvider = Objects.requireNonNull(contextProvider, "contextProvider must not be null");
        this.streamExecutor = Objects.requireNonNull(streamExecutor, "streamExecutor must not be null");
    }

    /**
     * Prepares a new session, resetting both queues and all retained audio.
     *
     * @return {@code false} if another session is active; the active session is left untouched
     */
    public boolean initialize(DictationMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        lock.lock();
        try {
            if (state.isActive()) {
                LOG.warn("Session {} already {}; rejecting new session", current.id, state);
                return false;
            }
            Session session = new Session(UUID.randomUUID().toString());
            session.audio.open();
            this.current = session;
            this.mode = mode;
            this.state = SessionState.INITIALIZED;
            LOG.info("Session {} initialized (mode={})", session.id, mode);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Opens the remote stream for the initialized session. May be called once per session.
     *
     * @return future completed with the transcript, or exceptionally with
     *         {@link StreamCancelledException} on cancel or the remote failure otherwise
     * @throws SessionStateException if no session is initialized or the stream is already open
     */
    public CompletableFuture<TranscriptResult> startRpc() {
        lock.lock();
        try {
            Session session = current;
            if (state != SessionState.INITIALIZED || session.result != null) {
                throw new SessionStateException("Stream cannot be started", state.name());
            }
            state = SessionState.STREAMING;

            CompletableFuture<TranscriptResult> future = new CompletableFuture<>();
            session.result = future;
            ReplayableRequestStream requests = new ReplayableRequestStream(
                    new OutboundStreamMerger(session.audio.drain(), session.controls, session.signal::isCancelled));

            LOG.info("Session {} opening transcription stream", session.id);
            streamExecutor.execute(() -> runStream(session, requests, future));
            return future;
        } finally {
            lock.unlock();
        }
    }

    private void runStream(Session session,
                           ReplayableRequestStream requests,
                           CompletableFuture<TranscriptResult> future) {
        String sid = session.id;
        CancellationSignal signal = session.signal;
        ThreadContext.put("sessionId", sid);
        try {
            TranscriptResponse response = rpcClient.transcribeStream(requests, signal);
            TranscriptResult transcript = new TranscriptResult(response.transcript(), response.error(),
                    session.audio.getBufferedAudio(), session.audio.getSampleRate());
            finish(session, SessionState.COMPLETED);
            LOG.info("Session {} received transcript ({} chars, error={})",
                    sid, transcript.transcript().length(), transcript.hasError());
            future.complete(transcript);
        } catch (StreamCancelledException e) {
            finish(session, SessionState.CANCELLED);
            future.completeExceptionally(e);
        } catch (RuntimeException e) {
            if (signal.isCancelled()) {
                LOG.debug("Session {} stream ended after cancellation: {}", sid, e.toString());
                future.completeExceptionally(new StreamCancelledException("Session cancelled", e));
            } else {
                LOG.warn("Session {} stream failed: {}", sid, e.getMessage());
                finish(session, SessionState.ERRORED);
                future.completeExceptionally(e);
            }
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    private void finish(Session session, SessionState terminal) {
        lock.lock();
        try {
            if (session != current || !state.isActive()) {
                return;
            }
            session.audio.close();
            state = terminal;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queues a mode change for the remote session. Only valid while streaming.
     *
     * @return {@code true} if the update was queued
     */
    public boolean setMode(DictationMode newMode) {
        Objects.requireNonNull(newMode, "mode must not be null");
        lock.lock();
        try {
            if (state != SessionState.STREAMING) {
                LOG.warn("Cannot change mode to {} while {}", newMode, state);
                return false;
            }
            mode = newMode;
            current.controls.enqueue(new ModeUpdate(newMode));
            LOG.debug("Session {} mode update queued: {}", current.id, newMode);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gathers context for the current mode and queues it as a {@link ConfigSnapshot}. Blocks while
     * the context is gathered; audio keeps flowing meanwhile. Failures are logged, never thrown.
     *
     * @return {@code true} if a snapshot was queued
     */
    public boolean sendContextSnapshot() {
        Session session;
        DictationMode snapshotMode;
        lock.lock();
        try {
            if (state != SessionState.INITIALIZED && state != SessionState.STREAMING) {
                LOG.warn("Cannot send context while {}", state);
                return false;
            }
            session = current;
            snapshotMode = mode;
        } finally {
            lock.unlock();
        }

        ContextSnapshot context;
        try {
            context = contextProvider.gatherContext(snapshotMode);
        } catch (RuntimeException e) {
            LOG.warn("Session {} context gathering failed: {}", session.id, e.getMessage());
            return false;
        }

        lock.lock();
        try {
            if (session != current || !state.isActive()) {
                LOG.debug("Session {} ended before context was ready; dropping snapshot", session.id);
                return false;
            }
            session.controls.enqueue(ConfigSnapshot.of(mode, context));
            session.context = context;
            LOG.debug("Session {} context snapshot queued", session.id);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Signals end of input. The outbound stream drains what is queued and the remote call
     * completes normally. Only valid while streaming.
     *
     * @return {@code true} if the session moved to ENDING
     */
    public boolean endInteraction() {
        lock.lock();
        try {
            if (state != SessionState.STREAMING) {
                LOG.warn("No streaming session to end (state={})", state);
                return false;
            }
            state = SessionState.ENDING;
            current.audio.close();
            LOG.info("Session {} ending; {} ms of audio buffered", current.id, current.audio.getBufferedDurationMs());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the active session: stops the outbound stream, aborts the remote call and fails the
     * result future with {@link StreamCancelledException}. Buffered audio stays readable until the
     * next {@link #initialize}. A no-op when no session is active.
     *
     * @return {@code true} if an active session was cancelled
     */
    public boolean cancel() {
        Session session;
        lock.lock();
        try {
            if (!state.isActive()) {
                LOG.debug("Nothing to cancel (state={})", state);
                return false;
            }
            session = current;
            state = SessionState.CANCELLED;
            session.signal.cancel();
            session.audio.close();
            LOG.info("Session {} cancelled", session.id);
        } finally {
            lock.unlock();
        }
        CompletableFuture<TranscriptResult> future = session.result;
        if (future != null) {
            future.completeExceptionally(new StreamCancelledException("Session cancelled"));
        }
        return true;
    }

    /** Capture callback: forwards a frame to the outbound stream and the retained buffer. */
    public void onAudioFrame(AudioFrame frame) {
        Session session = current;
        if (session == null) {
            LOG.trace("Dropping frame; no session initialized");
            return;
        }
        session.audio.push(frame);
    }

    /** Capture callback: records the effective sample rate reported by the device. */
    public void onAudioConfig(int sampleRate) {
        Session session = current;
        if (session != null) {
            session.audio.setSampleRate(sampleRate);
        }
    }

    public long getBufferedDurationMs() {
        Session session = current;
        return session == null ? 0 : session.audio.getBufferedDurationMs();
    }

    public byte[] getBufferedAudio() {
        Session session = current;
        return session == null ? new byte[0] : session.audio.getBufferedAudio();
    }

    public double getBufferedEnergy() {
        Session session = current;
        return session == null ? 0.0 : session.audio.getBufferedEnergy();
    }

    public int getSampleRate() {
        Session session = current;
        return session == null ? AudioFormat.DEFAULT_SAMPLE_RATE : session.audio.getSampleRate();
    }

    /** Vocabulary from the current session's context snapshot; empty until one was gathered. */
    public List<String> getVocabulary() {
        Session session = current;
        ContextSnapshot context = session == null ? null : session.context;
        return context == null || context.vocabulary() == null ? List.of() : context.vocabulary();
    }

    public SessionState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public String getSessionId() {
        lock.lock();
        try {
            return current == null ? null : current.id;
        } finally {
            lock.unlock();
        }
    }

    public DictationMode getMode() {
        lock.lock();
        try {
            return mode;
        } finally {
            lock.unlock();
        }
    }

    /** Queues, cancel signal and result of one session; never reused. */
    private static final class Session {
        final String id;
        final AudioBufferQueue audio = new AudioBufferQueue();
        final ControlMessageQueue controls = new ControlMessageQueue();
        final CancellationSignal signal = new CancellationSignal();
        CompletableFuture<TranscriptResult> result;
        volatile ContextSnapshot context;

        Session(String id) {
            this.id = id;
        }
    }
}
