package com.example.summarizer_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configures worker polling and the bounded pool summary jobs run on.
 */
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    private long pollIntervalMs = 2000;
    private int pollBatchSize = 4;
    private int maxConcurrency = 2;
    private int executorQueueCapacity = 16;

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public int getPollBatchSize() {
        return pollBatchSize;
    }

    public void setPollBatchSize(int pollBatchSize) {
        this.pollBatchSize = pollBatchSize;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }
}
