package com.phillippitts.speakstream.service.session;

import com.phillippitts.speakstream.config.session.SessionProperties;
import com.phillippitts.speakstream.domain.DictationMode;
import com.phillippitts.speakstream.domain.TranscriptResult;
import com.phillippitts.speakstream.exception.RpcException;
import com.phillippitts.speakstream.exception.SessionStateException;
import com.phillippitts.speakstream.exception.StreamCancelledException;
import com.phillippitts.speakstream.service.audio.capture.AudioCaptureSource;
import com.phillippitts.speakstream.service.context.ContextProvider;
import com.phillippitts.speakstream.service.insertion.TextInsertionSink;
import com.phillippitts.speakstream.service.metrics.SessionMetricsPublisher;
import com.phillippitts.speakstream.service.stream.SessionState;
import com.phillippitts.speakstream.service.stream.StreamSessionController;
import com.phillippitts.speakstream.util.LogSanitizer;
import com.phillippitts.speakstream.util.TimeUtils;
import com.phillippitts.speakstream.util.Timeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sequences one user-visible dictation: capture, stream, then finalize or discard.
 *
 * <p>{@link #startSession} opens the session and the remote stream before capture starts so no
 * audio is lost, then sends the initial mode and gathers context in the background.
 * {@link #completeSession} stops capture and applies the minimum-utterance gate: shorter audio is
 * cancelled without a transcript. Otherwise the transcript is awaited, grammar-corrected,
 * inserted and stored; a remote error stores a failed interaction and inserts nothing.
 *
 * <p><b>Thread Safety:</b> methods may be called from any thread. The pending result is handed
 * over atomically so a new session can start while the previous one is still being finalized.
 */
public class SessionManager {

    private static final Logger LOG = LogManager.getLogger(SessionManager.class);

    private final StreamSessionController controller;
    private final AudioCaptureSource captureSource;
    private final ContextProvider contextProvider;
    private final TextInsertionSink textSink;
    private final InteractionRecorder recorder;
    private final GrammarRulesService grammar;
    private final SessionProperties props;
    private final SessionMetricsPublisher metrics;
    private final Executor backgroundExecutor;
    private final String captureDeviceId;

    private final AtomicReference<CompletableFuture<TranscriptResult>> pending = new AtomicReference<>();
    private volatile String cursorContext = "";

    public SessionManager(StreamSessionController controller,
                          AudioCaptureSource captureSource,
                          ContextProvider contextProvider,
                          TextInsertionSink textSink,
                          InteractionRecorder recorder,
                          GrammarRulesService grammar,
                          SessionProperties props,
                          SessionMetricsPublisher metrics,
                          Executor backgroundExecutor,
                          String captureDeviceId) {
        this.controller = Objects.requireNonNull(controller, "controller must not be null");
        this.captureSource = Objects.requireNonNull(captureSource, "captureSource must not be null");
        this.contextProvider = Objects.requireNonNull(contextProvider, "contextProvider must not be null");
        this.textSink = Objects.requireNonNull(textSink, "textSink must not be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.metrics = metrics == null ? SessionMetricsPublisher.NOOP : metrics;
        this.backgroundExecutor = Objects.requireNonNull(backgroundExecutor, "backgroundExecutor must not be null");
        this.captureDeviceId = captureDeviceId;

        captureSource.onFrame(controller::onAudioFrame);
        captureSource.onConfig(controller::onAudioConfig);
    }

    /**
     * Starts a dictation session in {@code mode}.
     *
     * @return {@code false} if a session is already active or capture could not start
     */
    public boolean startSession(DictationMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        if (!controller.initialize(mode)) {
            return false;
        }
        String sid = controller.getSessionId();
        ThreadContext.put("sessionId", sid);
        try {
            CompletableFuture<TranscriptResult> future;
            try {
                future = controller.startRpc();
            } catch (SessionStateException e) {
                LOG.warn("Session {} could not open stream: {}", sid, e.getMessage());
                controller.cancel();
                return false;
            }
            pending.set(future);
            cursorContext = "";

            try {
                captureSource.start(captureDeviceId);
            } catch (RuntimeException e) {
                LOG.error("Session {} capture failed to start: {}", sid, e.getMessage());
                pending.compareAndSet(future, null);
                controller.cancel();
                awaitCancellation(future);
                metrics.recordErrored("capture_error");
                return false;
            }

            controller.setMode(mode);
            metrics.recordStarted();
            backgroundExecutor.execute(() -> fetchAndSendContext(sid));
            LOG.info("Session {} started (mode={})", sid, mode);
            return true;
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    private void fetchAndSendContext(String sid) {
        ThreadContext.put("sessionId", sid);
        try {
            controller.sendContextSnapshot();
            if (props.isGrammarEnabled()) {
                String ctx = contextProvider.getCursorContext(props.getCursorContextLength());
                if (sid.equals(controller.getSessionId())) {
                    cursorContext = ctx == null ? "" : ctx;
                }
            }
        } catch (RuntimeException e) {
            LOG.warn("Session {} background context failed: {}", sid, e.getMessage());
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    /** Changes the mode of the streaming session; ignored when nothing is streaming. */
    public boolean setMode(DictationMode mode) {
        return controller.setMode(mode);
    }

    /**
     * Cancels the active session and stops capture. Nothing is inserted or stored.
     *
     * @return {@code true} if a session was cancelled
     */
    public boolean cancelSession() {
        CompletableFuture<TranscriptResult> future = pending.getAndSet(null);
        boolean cancelled = controller.cancel();
        stopCapture();
        awaitCancellation(future);
        if (cancelled) {
            metrics.recordCancelled();
        }
        return cancelled;
    }

    /**
     * Ends input and finalizes the session.
     *
     * <p>Blocks until the transcript arrives or {@code session.response-timeout-ms} elapses.
     */
    public CompletionOutcome completeSession() {
        CompletableFuture<TranscriptResult> future = pending.getAndSet(null);
        if (future == null) {
            LOG.debug("completeSession called with no pending session");
            return CompletionOutcome.NO_SESSION;
        }
        String sid = controller.getSessionId();
        ThreadContext.put("sessionId", sid);
        try {
            stopCapture();

            long durationMs = controller.getBufferedDurationMs();
            if (durationMs < props.getMinimumAudioDurationMs()) {
                LOG.info("Audio too short ({} ms < {} ms); discarding session",
                        durationMs, props.getMinimumAudioDurationMs());
                controller.cancel();
                awaitCancellation(future);
                metrics.recordDiscarded();
                return CompletionOutcome.DISCARDED;
            }

            if (!controller.endInteraction()) {
                LOG.debug("Session {} no longer streaming (state={})", sid, controller.getState());
            }
            return awaitAndHandle(future, System.nanoTime());
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    private CompletionOutcome awaitAndHandle(CompletableFuture<TranscriptResult> future, long endedNanos) {
        TranscriptResult result;
        try {
            result = future.get(props.getResponseTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            return handleFailure(e.getCause());
        } catch (TimeoutException e) {
            LOG.warn("No transcript within {} ms; cancelling", props.getResponseTimeoutMs());
            controller.cancel();
            metrics.recordErrored("timeout");
            return CompletionOutcome.FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            controller.cancel();
            return CompletionOutcome.CANCELLED;
        }
        return handleResult(result, endedNanos);
    }

    private CompletionOutcome handleFailure(Throwable cause) {
        if (cause instanceof StreamCancelledException) {
            LOG.debug("Session cancelled while completing");
            return CompletionOutcome.CANCELLED;
        }
        if (cause instanceof RpcException rpc && rpc.isUnauthenticated()) {
            LOG.warn("Transcription rejected after re-authentication: {}", rpc.getMessage());
            metrics.recordErrored("auth_invalidated");
        } else {
            LOG.error("Transcription failed: {}", cause == null ? "unknown" : cause.getMessage(), cause);
            metrics.recordErrored("transport_error");
        }
        return CompletionOutcome.FAILED;
    }

    private CompletionOutcome handleResult(TranscriptResult result, long endedNanos) {
        if (result.hasError()) {
            LOG.warn("Service returned error {}: {}", result.error().code(), result.error().message());
            recorder.createInteraction(result.transcript(), result.audio(), result.sampleRate(),
                    result.error().message());
            metrics.recordErrored("remote_error");
            return CompletionOutcome.REMOTE_ERROR;
        }
        long latency = System.nanoTime() - endedNanos;
        if (!result.isInsertable()) {
            LOG.info("Empty transcript after {} ms; nothing to insert", TimeUtils.nanosToMillis(latency));
            metrics.recordCompleted(latency);
            return CompletionOutcome.EMPTY;
        }

        String text = result.transcript();
        if (props.isGrammarEnabled()) {
            text = grammar.apply(text, cursorContext, controller.getVocabulary());
        }
        LOG.debug("Inserting '{}'", LogSanitizer.truncate(text, 120));
        boolean inserted = textSink.insertText(text);
        recorder.createInteraction(result.transcript(), result.audio(), result.sampleRate(), null);
        metrics.recordCompleted(latency);
        LOG.info("Transcript handled {} ms after input ended (chars={}, inserted={})",
                TimeUtils.nanosToMillis(latency), text.length(), inserted);
        return inserted ? CompletionOutcome.INSERTED : CompletionOutcome.INSERTION_FAILED;
    }

    private void stopCapture() {
        try {
            captureSource.stop();
        } catch (RuntimeException e) {
            LOG.warn("Capture stop failed: {}", e.getMessage());
        }
    }

    private void awaitCancellation(CompletableFuture<TranscriptResult> future) {
        if (future == null) {
            return;
        }
        try {
            future.get(Timeouts.CANCEL_SETTLE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            LOG.debug("Stream ended after cancel: {}", e.getCause() == null ? "?" : e.getCause().toString());
        } catch (TimeoutException e) {
            LOG.warn("Stream did not settle within {} ms of cancel", Timeouts.CANCEL_SETTLE_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public long getBufferedDurationMs() {
        return controller.getBufferedDurationMs();
    }

    public SessionState getState() {
        return controller.getState();
    }

    public DictationMode getMode() {
        return controller.getMode();
    }

    public String getSessionId() {
        return controller.getSessionId();
    }

    String getCursorContext() {
        return cursorContext;
    }
}
