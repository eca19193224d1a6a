package com.energy.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    public static final String DETECTION_EXECUTOR = "detectionExecutor";

    /**
     * Bounded pool for independent detection runs. A full queue rejects new work rather
     * than growing without limit.
     */
    @Bean(name = DETECTION_EXECUTOR)
    public Executor detectionExecutor(DetectionProperties properties) {
        DetectionProperties.Async async = properties.getAsync();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(async.getCorePoolSize());
        executor.setMaxPoolSize(async.getMaxPoolSize());
        executor.setQueueCapacity(async.getQueueCapacity());
        executor.setThreadNamePrefix("detection-");
        executor.initialize();
        return executor;
    }
}
