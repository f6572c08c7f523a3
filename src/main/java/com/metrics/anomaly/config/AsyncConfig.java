package com.metrics.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded worker pools. Both reject when saturated instead of running work on the caller,
 * so neither the evaluation tick nor the ingestion path ever blocks on a slow channel or a
 * model retrain.
 */
@Configuration
public class AsyncConfig {

    @Bean("dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor(AlertingConfig alertingConfig) {
        AlertingConfig.Dispatch dispatch = alertingConfig.getDispatch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(dispatch.getCorePoolSize());
        executor.setMaxPoolSize(dispatch.getMaxPoolSize());
        executor.setQueueCapacity(dispatch.getQueueCapacity());
        executor.setThreadNamePrefix("alert-dispatch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean("trainingExecutor")
    public ThreadPoolTaskExecutor trainingExecutor(DetectionConfig detectionConfig) {
        DetectionConfig.Reconstruction reconstruction = detectionConfig.getReconstruction();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(Math.max(1, reconstruction.getTrainingPoolSize()));
        executor.setQueueCapacity(reconstruction.getTrainingQueueCapacity());
        executor.setThreadNamePrefix("model-train-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
