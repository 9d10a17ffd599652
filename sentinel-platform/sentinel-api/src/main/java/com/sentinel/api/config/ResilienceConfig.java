package com.sentinel.api.config;

import com.sentinel.api.error.TransientIoException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.time.Duration;

/**
 * Timeouts and bounded retries for calls that leave the request thread:
 * the classifier backend and enforcement writes.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public TimeLimiter classifierTimeLimiter(
            @Value("${sentinel.classifier.timeout-ms:2000}") long timeoutMs) {
        return TimeLimiter.of("classifier", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .cancelRunningFuture(true)
                .build());
    }

    @Bean
    public Retry classifierRetry(
            @Value("${sentinel.classifier.max-attempts:3}") int maxAttempts,
            @Value("${sentinel.classifier.initial-backoff-ms:100}") long initialBackoffMs) {
        return Retry.of("classifier", RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(initialBackoffMs), 2.0))
                .build());
    }

    /**
     * Enforcement writes get exactly one synchronous retry before failing loud.
     */
    @Bean
    public Retry enforcementWriteRetry(
            @Value("${sentinel.enforcement.write-retry-backoff-ms:50}") long backoffMs) {
        return Retry.of("enforcement-write", RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(backoffMs))
                .retryExceptions(DataAccessException.class, TransactionException.class, TransientIoException.class)
                .build());
    }
}
