package com.leadintel.enricher.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadintel.enricher.model.BusinessRecord;
import com.leadintel.enricher.model.EnrichmentResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Enrichment outcomes keyed by domain (or place id when the business has no website),
 * so businesses sharing a website are only enriched once per TTL.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EnrichmentCache {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private record Entry(String json, Instant expiresAt) {}

    public static String keyFor(BusinessRecord business) {
        String domain = DomainNames.of(business.getWebsite());
        return domain != null ? "domain:" + domain : "place:" + business.getPlaceId();
    }

    /** @return the cached result, empty on a miss or when the entry has expired */
    public Optional<EnrichmentResult> lookup(String key) {
        List<Entry> rows = jdbcTemplate.query(
                "SELECT result_json, expires_at FROM enrichment_cache WHERE cache_key = ?",
                (rs, i) -> new Entry(rs.getString("result_json"), rs.getTimestamp("expires_at").toInstant()),
                key);
        if (rows.isEmpty()) return Optional.empty();

        Entry entry = rows.get(0);
        if (!entry.expiresAt().isAfter(clock.instant())) {
            log.debug("Cache entry {} expired at {}", key, entry.expiresAt());
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(entry.json(), EnrichmentResult.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cache entry {}, treating as miss: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /** Inserts or overwrites the entry for this key. */
    public void store(String key, EnrichmentResult result, Duration ttl) {
        Instant now = clock.instant();
        String json;
        try {
            json = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise enrichment result for " + key, e);
        }
        jdbcTemplate.update("""
            MERGE INTO enrichment_cache (cache_key, result_json, stored_at, expires_at)
            KEY (cache_key)
            VALUES (?,?,?,?)
            """, key, json, Timestamp.from(now), Timestamp.from(now.plus(ttl)));
    }

    public int purgeExpired() {
        int purged = jdbcTemplate.update("DELETE FROM enrichment_cache WHERE expires_at <= ?",
                Timestamp.from(clock.instant()));
        if (purged > 0) log.info("Purged {} expired enrichment cache entries", purged);
        return purged;
    }
}
