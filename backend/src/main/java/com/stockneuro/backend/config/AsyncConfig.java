package com.stockneuro.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    @Bean(name = "trainingExecutor")
    public Executor trainingExecutor(
            @Value("${stockneuro.executor.training.max-concurrent:0}") int maxConcurrent,
            @Value("${stockneuro.executor.training.queue-capacity:100}") int queueCapacity
    ) {
        int processors = Runtime.getRuntime().availableProcessors();
        int poolSize = maxConcurrent > 0 ? maxConcurrent : Math.max(2, processors / 2);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("training-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
