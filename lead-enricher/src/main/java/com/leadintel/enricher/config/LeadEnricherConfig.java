package com.leadintel.enricher.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class LeadEnricherConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(30))
                .defaultHeader("Accept", "application/json")
                .build();
    }

    /** Runs whole jobs; sized by lead-enricher.jobs.concurrency. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService jobExecutor(LeadEnricherProperties properties) {
        return Executors.newFixedThreadPool(properties.getJobs().getConcurrency(), named("job-"));
    }

    /** Bounded pool shared by every job for per-business enrichment. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService enrichmentWorkers(LeadEnricherProperties properties) {
        return Executors.newFixedThreadPool(properties.getEnrichment().getWorkerThreads(), named("enrich-"));
    }

    /** Carries individual strategy calls so they can be abandoned on timeout. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService strategyCallExecutor() {
        return Executors.newCachedThreadPool(named("strategy-call-"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
