package com.leadintel.enricher.service;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;

/**
 * The searchProvider retry policy with millisecond waits.
 */
public final class TestRetries {

    private TestRetries() {
    }

    public static Retry searchProvider() {
        return Retry.of("searchProvider", RetryConfig.custom()
                .maxAttempts(3)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(1), 2.0))
                .retryExceptions(TransientProviderException.class)
                .ignoreExceptions(ProviderAuthException.class)
                .build());
    }
}
