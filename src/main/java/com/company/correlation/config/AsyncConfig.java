package com.company.correlation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for snapshot persistence and listener callbacks
 */
@Configuration
public class AsyncConfig {

    @Bean("correlationSideEffectExecutor")
    public ThreadPoolTaskExecutor correlationSideEffectExecutor(CorrelationProperties properties) {
        CorrelationProperties.Executor settings = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(settings.getCorePoolSize(), settings.getMaxPoolSize()));
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("correlation-side-effect-");

        // Queue full: rejected tasks are dropped and counted by the engine
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(settings.getAwaitTerminationSeconds());

        executor.initialize();
        return executor;
    }
}
