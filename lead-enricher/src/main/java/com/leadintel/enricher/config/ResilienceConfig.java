package com.leadintel.enricher.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Named Resilience4j policies. Instances are configured under resilience4j.retry.instances
 * in application.yml; the registry itself comes from the Resilience4j Spring Boot starter.
 */
@Configuration
public class ResilienceConfig {

    public static final String SEARCH_PROVIDER = "searchProvider";

    /**
     * Retry for search page fetches: exponential backoff on TransientProviderException,
     * never on ProviderAuthException.
     */
    @Bean
    public Retry searchProviderRetry(RetryRegistry registry) {
        return registry.retry(SEARCH_PROVIDER);
    }
}
