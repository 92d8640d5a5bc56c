package com.phillippitts.graphicrecorder.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>Connection tasks are short and must never block; provider calls and persistence
 * writes get their own pools so a slow provider cannot starve the socket handlers.
 */
@ConfigurationProperties(prefix = "recording.thread-pool")
@Validated
public class ThreadPoolProperties {

    @Valid
    private Pool connection = new Pool(4, 16, 1000, "ws-conn-");
    @Valid
    private Pool provider = new Pool(4, 8, 100, "provider-pool-");
    @Valid
    private Pool persistence = new Pool(2, 4, 1000, "persist-pool-");

    @Positive
    private int schedulerPoolSize = 2;

    public Pool getConnection() {
        return connection;
    }

    public void setConnection(Pool connection) {
        this.connection = connection;
    }

    public Pool getProvider() {
        return provider;
    }

    public void setProvider(Pool provider) {
        this.provider = provider;
    }

    public Pool getPersistence() {
        return persistence;
    }

    public void setPersistence(Pool persistence) {
        this.persistence = persistence;
    }

    public int getSchedulerPoolSize() {
        return schedulerPoolSize;
    }

    public void setSchedulerPoolSize(int schedulerPoolSize) {
        this.schedulerPoolSize = schedulerPoolSize;
    }

    /**
     * Sizing for one executor.
     */
    public static class Pool {
        @Positive
        private int corePoolSize;
        @Positive
        private int maxPoolSize;
        @Positive
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public Pool() {
        }

        Pool(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
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
