package com.stockneuro.backend.config;

import com.stockneuro.backend.exception.TrainingDivergedException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class TrainingResilienceConfig {

    /**
     * One retry after a divergence; every attempt asks the brain for fresh hyperparameters.
     */
    @Bean
    public Retry trainingDivergenceRetry(
            @Value("${stockneuro.resilience.divergence.max-attempts:2}") int maxAttempts,
            @Value("${stockneuro.resilience.divergence.wait-ms:100}") long waitMs
    ) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(Duration.ofMillis(waitMs))
                .retryExceptions(TrainingDivergedException.class)
                .build();
        return Retry.of("training-divergence", config);
    }
}
