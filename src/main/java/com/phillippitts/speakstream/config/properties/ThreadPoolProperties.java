package com.phillippitts.speakstream.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>{@code stream} runs the long-lived transcription calls, {@code event} runs context
 * gathering and cancel requests, {@code session} serializes hotkey-driven session changes.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties stream = new PoolProperties(2, 4, 8, "stream-pool-");
    private PoolProperties event = new PoolProperties(2, 4, 10, "event-pool-");
    private PoolProperties session = new PoolProperties(1, 1, 16, "session-");

    public PoolProperties getStream() {
        return stream;
    }

    public void setStream(PoolProperties stream) {
        this.stream = stream;
    }

    public PoolProperties getEvent() {
        return event;
    }

    public void setEvent(PoolProperties event) {
        this.event = event;
    }

    public PoolProperties getSession() {
        return session;
    }

    public void setSession(PoolProperties session) {
        this.session = session;
    }

    /**
     * Sizing for one executor.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
            this(1, 1, 10, "pool-");
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
