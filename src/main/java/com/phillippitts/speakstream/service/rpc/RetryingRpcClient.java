package com.phillippitts.speakstream.service.rpc;

import com.phillippitts.speakstream.domain.DictionaryItem;
import com.phillippitts.speakstream.domain.InteractionRecord;
import com.phillippitts.speakstream.domain.ModelSettings;
import com.phillippitts.speakstream.exception.RpcException;
import com.phillippitts.speakstream.service.metrics.SessionMetricsPublisher;
import com.phillippitts.speakstream.service.rpc.auth.AuthenticationHandler;
import com.phillippitts.speakstream.service.stream.StreamRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Applies a single retry after re-authentication to every remote call.
 *
 * <p>When a call fails with {@code UNAUTHENTICATED}:
 * <ul>
 *   <li>if another caller is already refreshing tokens, the original error propagates;</li>
 *   <li>otherwise tokens are refreshed once; on success the call is retried exactly once and its
 *       outcome (success or failure) is returned as is;</li>
 *   <li>if the refresh fails, {@link AuthenticationHandler#onAuthInvalidated()} is notified and the
 *       original error propagates.</li>
 * </ul>
 * Any other failure propagates untouched.
 *
 * <p><b>Thread Safety:</b> the refresh lock is held by this instance, which is a singleton in the
 * application context, so refreshes are serialized process-wide.
 */
public class RetryingRpcClient implements TranscriptionServiceClient {

    private static final Logger LOG = LogManager.getLogger(RetryingRpcClient.class);

    private final TranscriptionServiceClient delegate;
    private final AuthenticationHandler auth;
    private final SessionMetricsPublisher metrics;
    private final ReentrantLock refreshLock = new ReentrantLock();

    public RetryingRpcClient(TranscriptionServiceClient delegate,
                             AuthenticationHandler auth,
                             SessionMetricsPublisher metrics) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.auth = Objects.requireNonNull(auth, "auth must not be null");
        this.metrics = metrics == null ? SessionMetricsPublisher.NOOP : metrics;
    }

    /**
     * Runs {@code call}, refreshing credentials and retrying once on an authentication failure.
     *
     * @param operation name used in logs
     * @param call      the remote operation
     * @return the result of the first successful attempt
     * @throws RpcException the original failure, or the retry's failure
     */
    public <T> T withAuthRetry(String operation, RpcCall<T> call) {
        Objects.requireNonNull(call, "call must not be null");
        try {
            return call.execute();
        } catch (RpcException e) {
            if (!e.isUnauthenticated()) {
                throw e;
            }
            if (!refreshTokensOnce(operation, e)) {
                throw e;
            }
        }
        LOG.info("Retrying {} after token refresh", operation);
        try {
            T result = call.execute();
            metrics.recordAuthRetry(true);
            return result;
        } catch (RuntimeException retryFailure) {
            metrics.recordAuthRetry(false);
            throw retryFailure;
        }
    }

    boolean isRefreshInProgress() {
        return refreshLock.isLocked();
    }

    private boolean refreshTokensOnce(String operation, RpcException original) {
        if (!refreshLock.tryLock()) {
            LOG.info("{} unauthenticated while a token refresh is in progress; not retrying", operation);
            return false;
        }
        try {
            LOG.info("{} unauthenticated; refreshing tokens", operation);
            auth.refreshTokens();
            return true;
        } catch (RuntimeException refreshFailure) {
            LOG.warn("Token refresh failed after {} was rejected: {}", operation, refreshFailure.getMessage());
            original.addSuppressed(refreshFailure);
            metrics.recordAuthRefreshFailure();
            auth.onAuthInvalidated();
            return false;
        } finally {
            refreshLock.unlock();
        }
    }

    @Override
    public TranscriptResponse transcribeStream(Iterable<StreamRequest> requests, CancellationSignal cancellation) {
        return withAuthRetry("transcribeStream", () -> delegate.transcribeStream(requests, cancellation));
    }

    @Override
    public InteractionRecord createInteraction(InteractionRecord interaction) {
        return withAuthRetry("createInteraction", () -> delegate.createInteraction(interaction));
    }

    @Override
    public InteractionRecord updateInteraction(InteractionRecord interaction) {
        return withAuthRetry("updateInteraction", () -> delegate.updateInteraction(interaction));
    }

    @Override
    public void deleteInteraction(String interactionId) {
        withAuthRetry("deleteInteraction", () -> {
            delegate.deleteInteraction(interactionId);
            return null;
        });
    }

    @Override
    public List<InteractionRecord> listInteractionsSince(Instant since) {
        return withAuthRetry("listInteractionsSince", () -> delegate.listInteractionsSince(since));
    }

    @Override
    public List<DictionaryItem> listDictionaryItemsSince(Instant since) {
        return withAuthRetry("listDictionaryItemsSince", () -> delegate.listDictionaryItemsSince(since));
    }

    @Override
    public ModelSettings getAdvancedSettings() {
        return withAuthRetry("getAdvancedSettings", delegate::getAdvancedSettings);
    }
}
