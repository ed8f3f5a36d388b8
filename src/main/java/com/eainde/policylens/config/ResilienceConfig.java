package com.eainde.policylens.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Capped exponential retries for the external calls: embedding and reasoning.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public Retry embeddingRetry(PolicyLensProperties properties) {
        return Retry.of("embedding", retryConfig(properties.getRetry()));
    }

    @Bean
    public Retry reasoningRetry(PolicyLensProperties properties) {
        return Retry.of("reasoning", retryConfig(properties.getRetry()));
    }

    static RetryConfig retryConfig(PolicyLensProperties.RetrySettings settings) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialBackoff(
                settings.getInitialInterval(),
                settings.getMultiplier());
        return RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(intervalFunction)
                .build();
    }
}
