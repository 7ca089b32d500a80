package com.budgetpacing.config;

import com.budgetpacing.exception.AdPlatformException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class ResilienceConfig {

    public static final String AD_PLATFORM_COMMIT = "ad-platform-commit";

    @Bean
    public RetryRegistry retryRegistry(PacingProperties properties) {
        PacingProperties.Commit commit = properties.getCommit();
        RetryRegistry registry = RetryRegistry.ofDefaults();

        // only transient platform errors are retried, with exponential backoff
        RetryConfig commitRetryConfig =
                RetryConfig.custom()
                        .maxAttempts(commit.getMaxAttempts())
                        .intervalFunction(
                                IntervalFunction.ofExponentialBackoff(
                                        commit.getInitialBackoff(),
                                        commit.getBackoffMultiplier()))
                        .retryOnException(
                                throwable ->
                                        throwable instanceof AdPlatformException platformError
                                                && platformError.isRetryable())
                        .build();
        registry.retry(AD_PLATFORM_COMMIT, commitRetryConfig);

        addRetryEventListeners(registry);
        return registry;
    }

    @Bean
    public Retry adPlatformCommitRetry(RetryRegistry registry) {
        return registry.retry(AD_PLATFORM_COMMIT);
    }

    private void addRetryEventListeners(RetryRegistry registry) {
        registry.getAllRetries()
                .forEach(
                        retry ->
                                retry.getEventPublisher()
                                        .onRetry(
                                                event ->
                                                        log.warn(
                                                                "Retry {} attempt {} after: {}",
                                                                event.getName(),
                                                                event.getNumberOfRetryAttempts(),
                                                                event.getLastThrowable()
                                                                        .getMessage()))
                                        .onError(
                                                event ->
                                                        log.error(
                                                                "Retry {} exhausted after {}"
                                                                        + " attempts: {}",
                                                                event.getName(),
                                                                event.getNumberOfRetryAttempts(),
                                                                event.getLastThrowable()
                                                                        .getMessage())));
    }
}
