package com.example.thumbgen_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Provides the thread pool used by {@link com.example.thumbgen_backend.service.IdentityTrainingLauncher}
 * to start trainings asynchronously.
 */
@Configuration
@EnableConfigurationProperties(WorkerExecutorProperties.class)
public class WorkerExecutorConfig {

    @Bean(name = "workerTaskExecutor")
    public ThreadPoolTaskExecutor workerTaskExecutor(WorkerExecutorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getExecutorThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("identity-train-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getShutdownAwaitSeconds());
        executor.initialize();
        return executor;
    }
}
