package com.phillippitts.speakstream.config.session;

import com.phillippitts.speakstream.config.audio.AudioCaptureProperties;
import com.phillippitts.speakstream.config.auth.AuthProperties;
import com.phillippitts.speakstream.config.transport.TransportProperties;
import com.phillippitts.speakstream.domain.ModelSettings;
import com.phillippitts.speakstream.service.audio.capture.AudioCaptureSource;
import com.phillippitts.speakstream.service.audio.capture.JavaSoundAudioCaptureSource;
import com.phillippitts.speakstream.service.context.AppleScriptForegroundAppInspector;
import com.phillippitts.speakstream.service.context.ContextGrabber;
import com.phillippitts.speakstream.service.context.ContextProvider;
import com.phillippitts.speakstream.service.context.ForegroundAppInspector;
import com.phillippitts.speakstream.service.insertion.TextInsertionSink;
import com.phillippitts.speakstream.service.metrics.SessionMetricsPublisher;
import com.phillippitts.speakstream.service.rpc.RetryingRpcClient;
import com.phillippitts.speakstream.service.rpc.TranscriptionServiceClient;
import com.phillippitts.speakstream.service.rpc.auth.AuthTokenStore;
import com.phillippitts.speakstream.service.rpc.auth.AuthenticationHandler;
import com.phillippitts.speakstream.service.rpc.auth.OAuthAuthenticationHandler;
import com.phillippitts.speakstream.service.rpc.http.HttpTranscriptionServiceClient;
import com.phillippitts.speakstream.service.session.GrammarRulesService;
import com.phillippitts.speakstream.service.session.InteractionRecorder;
import com.phillippitts.speakstream.service.session.RemoteInteractionRecorder;
import com.phillippitts.speakstream.service.session.SessionManager;
import com.phillippitts.speakstream.service.stream.StreamSessionController;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Executor;

/**
 * Wires the session pipeline explicitly: transport, auth retry, context, capture, the single
 * {@link StreamSessionController} and the {@link SessionManager} that drives it.
 */
@Configuration
public class SessionConfig {

    private static final Logger LOG = LogManager.getLogger(SessionConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public HttpClient transportHttpClient(TransportProperties transport) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(transport.getConnectTimeoutMs()))
                .build();
    }

    @Bean
    public HttpTranscriptionServiceClient httpTranscriptionServiceClient(TransportProperties transport,
                                                                         AuthTokenStore tokens,
                                                                         HttpClient httpClient) {
        return new HttpTranscriptionServiceClient(transport, tokens, httpClient);
    }

    @Bean
    public AuthenticationHandler authenticationHandler(AuthProperties auth,
                                                       AuthTokenStore tokens,
                                                       ApplicationEventPublisher publisher,
                                                       HttpClient httpClient) {
        return new OAuthAuthenticationHandler(auth, tokens, publisher, httpClient);
    }

    /**
     * The client every caller uses; all remote calls go through the single re-auth retry.
     */
    @Bean
    @Primary
    public RetryingRpcClient transcriptionServiceClient(HttpTranscriptionServiceClient delegate,
                                                        AuthenticationHandler auth,
                                                        SessionMetricsPublisher metrics) {
        return new RetryingRpcClient(delegate, auth, metrics);
    }

    @Bean
    public ForegroundAppInspector foregroundAppInspector() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("mac")) {
            return new AppleScriptForegroundAppInspector();
        }
        LOG.info("No foreground app inspector for '{}'; window context disabled", os);
        return ForegroundAppInspector.unavailable();
    }

    @Bean
    public ContextGrabber contextGrabber(ForegroundAppInspector inspector, TranscriptionServiceClient rpcClient) {
        return new ContextGrabber(inspector, rpcClient, ModelSettings.empty());
    }

    @Bean
    public AudioCaptureSource audioCaptureSource(AudioCaptureProperties props, ApplicationEventPublisher publisher) {
        return new JavaSoundAudioCaptureSource(props, publisher);
    }

    @Bean
    public StreamSessionController streamSessionController(TranscriptionServiceClient rpcClient,
                                                           ContextProvider contextProvider,
                                                           @Qualifier("streamExecutor") Executor streamExecutor) {
        return new StreamSessionController(rpcClient, contextProvider, streamExecutor);
    }

    @Bean
    public GrammarRulesService grammarRulesService() {
        return new GrammarRulesService();
    }

    @Bean
    public InteractionRecorder interactionRecorder(TranscriptionServiceClient rpcClient) {
        return new RemoteInteractionRecorder(rpcClient);
    }

    // CHECKSTYLE.OFF: ParameterNumber - explicit wiring of the session collaborators
    @Bean
    public SessionManager sessionManager(StreamSessionController controller,
                                         AudioCaptureSource captureSource,
                                         ContextProvider contextProvider,
                                         TextInsertionSink textSink,
                                         InteractionRecorder recorder,
                                         GrammarRulesService grammar,
                                         SessionProperties sessionProperties,
                                         SessionMetricsPublisher metrics,
                                         @Qualifier("eventExecutor") Executor eventExecutor,
                                         AudioCaptureProperties captureProperties) {
        return new SessionManager(controller, captureSource, contextProvider, textSink, recorder, grammar,
                sessionProperties, metrics, eventExecutor, captureProperties.getDeviceName());
    }
    // CHECKSTYLE.ON: ParameterNumber
}
