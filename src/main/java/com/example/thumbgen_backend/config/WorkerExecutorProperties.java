package com.example.thumbgen_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sizes the executor that launches identity trainings off the request thread.
 */
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    private int executorThreads = 2;
    private int executorQueueCapacity = 50;
    private int shutdownAwaitSeconds = 30;

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    public int getShutdownAwaitSeconds() {
        return shutdownAwaitSeconds;
    }

    public void setShutdownAwaitSeconds(int shutdownAwaitSeconds) {
        this.shutdownAwaitSeconds = shutdownAwaitSeconds;
    }
}
