package com.phillippitts.speakstream.config;

import com.phillippitts.speakstream.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void streamExecutorUsesDefaults() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.streamExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(2);
            assertThat(executor.getMaxPoolSize()).isEqualTo(4);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("stream-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void eventExecutorUsesDefaults() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.eventExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(2);
            assertThat(executor.getMaxPoolSize()).isEqualTo(4);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("event-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void sessionExecutorIsSingleThreaded() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.sessionExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(1);
            assertThat(executor.getMaxPoolSize()).isEqualTo(1);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("session-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldPropagateThreadContextToWorker() throws Exception {
        Executor executor = config.eventExecutor();
        ThreadContext.put("sessionId", "abc");
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        executor.execute(() -> {
            seen.set(ThreadContext.get("sessionId"));
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("abc");
        ((ThreadPoolTaskExecutor) executor).shutdown();
    }

    @Test
    void decoratorRestoresWorkerContextAfterRun() {
        TaskDecorator decorator = ThreadPoolConfig.mdcPropagating();
        ThreadContext.put("sessionId", "submitted");
        Runnable decorated = decorator.decorate(() ->
                assertThat(ThreadContext.get("sessionId")).isEqualTo("submitted"));

        ThreadContext.clearAll();
        ThreadContext.put("sessionId", "worker");
        decorated.run();

        assertThat(ThreadContext.get("sessionId")).isEqualTo("worker");
    }
}
