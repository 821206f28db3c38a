package com.leadintel.enricher.scheduler;

import com.leadintel.enricher.config.LeadEnricherProperties;
import com.leadintel.enricher.enrichment.EnrichmentCache;
import com.leadintel.enricher.service.JobOrchestrator;
import com.leadintel.enricher.store.SchemaInitializer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Start-up and housekeeping.
 *
 * On start-up the schema is ensured and, unless lead-enricher.jobs.resume-on-startup=false,
 * every job a previous process left QUEUED or RUNNING is resumed from its checkpoint.
 * Expired enrichment cache entries are purged nightly (03:30 UTC by default).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MaintenanceScheduler {

    private final SchemaInitializer schemaInitializer;
    private final JobOrchestrator orchestrator;
    private final EnrichmentCache enrichmentCache;
    private final LeadEnricherProperties properties;

    @PostConstruct
    public void ensureSchema() {
        schemaInitializer.ensureSchema();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (properties.getJobs().isResumeOnStartup()) {
            try {
                orchestrator.resumeInterrupted();
            } catch (Exception e) {
                log.error("Resuming interrupted jobs failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("Lead enricher ready, interrupted jobs left for manual resume");
        }
    }

    @Scheduled(cron = "${lead-enricher.jobs.cache-purge-cron:0 30 3 * * ?}", zone = "UTC")
    public void purgeExpiredCache() {
        try {
            enrichmentCache.purgeExpired();
        } catch (Exception e) {
            log.error("Cache purge failed: {}", e.getMessage(), e);
        }
    }
}
