package com.leadintel.enricher.enrichment;

import com.leadintel.enricher.budget.MutableClock;
import com.leadintel.enricher.model.BusinessRecord;
import com.leadintel.enricher.model.EmailCandidate;
import com.leadintel.enricher.model.EnrichmentResult;
import com.leadintel.enricher.store.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EnrichmentCacheTest {

    private static final Instant NOW = Instant.parse("2026-03-04T10:00:00Z");

    private MutableClock clock;
    private EnrichmentCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        cache = new EnrichmentCache(TestDatabase.fresh(), TestDatabase.objectMapper(), clock);
    }

    private static EnrichmentResult found(String email) {
        return EnrichmentResult.found("p1", List.of(new EmailCandidate(email, 0.9, "hunter")), "Jane Doe",
                LocalDateTime.of(2026, 3, 4, 10, 0), List.of("website-scrape", "hunter"));
    }

    @Test
    void keyIsTheDomainWhenThereIsOne() {
        BusinessRecord withSite = BusinessRecord.builder().placeId("p1").website("https://WWW.Acme.com/contact").build();
        BusinessRecord without = BusinessRecord.builder().placeId("p2").build();

        assertThat(EnrichmentCache.keyFor(withSite)).isEqualTo("domain:acme.com");
        assertThat(EnrichmentCache.keyFor(without)).isEqualTo("place:p2");
    }

    @Test
    void storedResultIsReadBackWhole() {
        EnrichmentResult result = found("jane@acme.com");
        cache.store("domain:acme.com", result, Duration.ofDays(30));

        assertThat(cache.lookup("domain:acme.com")).contains(result);
        assertThat(cache.lookup("domain:other.com")).isEmpty();
    }

    @Test
    void expiredEntryIsAMiss() {
        cache.store("domain:acme.com", found("jane@acme.com"), Duration.ofDays(1));

        clock.advance(Duration.ofHours(23));
        assertThat(cache.lookup("domain:acme.com")).isPresent();

        clock.advance(Duration.ofHours(1));
        assertThat(cache.lookup("domain:acme.com")).isEmpty();
    }

    @Test
    void storeOverwrites() {
        cache.store("domain:acme.com", found("old@acme.com"), Duration.ofDays(1));
        cache.store("domain:acme.com", found("new@acme.com"), Duration.ofDays(1));

        assertThat(cache.lookup("domain:acme.com"))
                .hasValueSatisfying(r -> assertThat(r.primary().email()).isEqualTo("new@acme.com"));
    }

    @Test
    void purgeRemovesOnlyExpiredEntries() {
        cache.store("domain:short.com", found("a@short.com"), Duration.ofHours(1));
        cache.store("domain:long.com", found("a@long.com"), Duration.ofDays(30));

        clock.advance(Duration.ofHours(2));

        assertThat(cache.purgeExpired()).isEqualTo(1);
        assertThat(cache.lookup("domain:long.com")).isPresent();
    }
}
