package com.leadintel.enricher;

import com.leadintel.enricher.enrichment.EnrichmentWaterfall;
import com.leadintel.enricher.service.JobOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:context;DB_CLOSE_DELAY=-1",
        "lead-enricher.jobs.resume-on-startup=false",
        "lead-enricher.geocoding.enabled=false",
        "logging.file.name="
})
class LeadEnricherApplicationTest {

    @Autowired
    private EnrichmentWaterfall waterfall;

    @Autowired
    private JobOrchestrator orchestrator;

    @Test
    void contextLoadsWithConfiguredWaterfall() {
        assertThat(waterfall.strategyNames())
                .containsExactly("website-scrape", "hunter", "pattern-generation");
        assertThat(orchestrator.list(10)).isEmpty();
    }
}
