package com.phillippitts.speakstream.config;

import com.phillippitts.speakstream.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for streaming calls, background event work and ordered session changes.
 *
 * <p>All pools copy the Log4j2 ThreadContext (MDC) of the submitting thread into the worker.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs one transcription call per session for its whole duration.
     *
     * <p>Rejection aborts instead of running on the caller: the caller is the session layer,
     * which must not block for the length of a stream.
     */
    @Bean(name = "streamExecutor")
    public Executor streamExecutor() {
        return build(threadPoolProperties.getStream(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Context gathering and cancel requests. Caller-runs when saturated.
     */
    @Bean(name = "eventExecutor")
    public Executor eventExecutor() {
        return build(threadPoolProperties.getEvent(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Single worker so hotkey press and release are handled in arrival order.
     */
    @Bean(name = "sessionExecutor")
    public Executor sessionExecutor() {
        return build(threadPoolProperties.getSession(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
