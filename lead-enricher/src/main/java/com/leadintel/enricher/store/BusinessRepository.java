package com.leadintel.enricher.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadintel.enricher.model.BusinessRecord;
import com.leadintel.enricher.model.EmailCandidate;
import com.leadintel.enricher.model.EnrichmentResult;
import com.leadintel.enricher.model.Lead;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Stores business listings and their current enrichment result.
 *
 * Re-importing a place id updates the listing in place; first_seen_at and
 * source_search keep the values of the first import.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class BusinessRepository {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void upsert(BusinessRecord r) {
        Timestamp now = Timestamp.valueOf(LocalDateTime.now(clock));
        int updated = update(r, now);
        if (updated > 0) return;

        try {
            jdbcTemplate.update("""
                INSERT INTO businesses
                (place_id, name, address, phone, website, latitude, longitude, rating, review_count,
                 categories, hours_json, source_search, first_seen_at, updated_at)
                VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                """,
                    r.getPlaceId(), r.getName(), r.getAddress(), r.getPhone(), r.getWebsite(),
                    r.getLatitude(), r.getLongitude(), r.getRating(), r.getReviewCount(),
                    toJson(r.getCategories()), r.getHoursJson(), r.getSourceSearch(),
                    r.getFirstSeenAt() != null ? Timestamp.valueOf(r.getFirstSeenAt()) : now, now);
        } catch (DuplicateKeyException e) {
            // another job inserted the same place between our update and insert
            update(r, now);
        }
    }

    private int update(BusinessRecord r, Timestamp now) {
        return jdbcTemplate.update("""
            UPDATE businesses
            SET name = ?, address = ?, phone = ?, website = ?, latitude = ?, longitude = ?,
                rating = ?, review_count = ?, categories = ?, hours_json = ?, updated_at = ?
            WHERE place_id = ?
            """,
                r.getName(), r.getAddress(), r.getPhone(), r.getWebsite(), r.getLatitude(), r.getLongitude(),
                r.getRating(), r.getReviewCount(), toJson(r.getCategories()), r.getHoursJson(), now,
                r.getPlaceId());
    }

    public Optional<BusinessRecord> findById(String placeId) {
        List<BusinessRecord> rows = jdbcTemplate.query(
                "SELECT * FROM businesses WHERE place_id = ?", businessMapper(), placeId);
        return rows.stream().findFirst();
    }

    /**
     * Businesses this job admitted but never finished, in admission order.
     * These are picked up first when a job resumes.
     */
    public List<BusinessRecord> findUnprocessedForJob(String jobId) {
        return jdbcTemplate.query("""
            SELECT b.* FROM businesses b
            JOIN dedup_index d ON d.place_id = b.place_id
            WHERE d.job_id = ? AND d.processed = FALSE
            ORDER BY d.admitted_at, b.place_id
            """, businessMapper(), jobId);
    }

    // ── Enrichment results ───────────────────────────────────────────────────

    public void saveEnrichment(EnrichmentResult result) {
        String json = resultJson(result);
        EmailCandidate primary = result.primary();
        Timestamp enrichedAt = Timestamp.valueOf(result.enrichedAt());

        int updated = jdbcTemplate.update("""
            UPDATE enrichment_results
            SET primary_email = ?, confidence = ?, source = ?, enrichment_failed = ?, enriched_at = ?, result_json = ?
            WHERE place_id = ?
            """,
                primary != null ? primary.email() : null,
                primary != null ? primary.confidence() : null,
                primary != null ? primary.source() : null,
                result.enrichmentFailed(), enrichedAt, json, result.placeId());
        if (updated == 0) {
            jdbcTemplate.update("""
                INSERT INTO enrichment_results
                (place_id, primary_email, confidence, source, enrichment_failed, enriched_at, result_json)
                VALUES (?,?,?,?,?,?,?)
                """,
                    result.placeId(),
                    primary != null ? primary.email() : null,
                    primary != null ? primary.confidence() : null,
                    primary != null ? primary.source() : null,
                    result.enrichmentFailed(), enrichedAt, json);
        }

        jdbcTemplate.update(
                "INSERT INTO enrichment_history (place_id, enriched_at, result_json) VALUES (?,?,?)",
                result.placeId(), enrichedAt, json);
    }

    public Optional<EnrichmentResult> findEnrichment(String placeId) {
        List<String> rows = jdbcTemplate.queryForList(
                "SELECT result_json FROM enrichment_results WHERE place_id = ?", String.class, placeId);
        return rows.stream().findFirst().map(this::parseResult);
    }

    // ── Output ───────────────────────────────────────────────────────────────

    /** Leads admitted by one job, newest first. */
    public List<Lead> findLeadsForJob(String jobId) {
        return jdbcTemplate.query("""
            SELECT b.*, e.result_json FROM businesses b
            JOIN dedup_index d ON d.place_id = b.place_id
            LEFT JOIN enrichment_results e ON e.place_id = b.place_id
            WHERE d.job_id = ?
            ORDER BY d.admitted_at DESC, b.place_id
            """, leadMapper(), jobId);
    }

    public List<Lead> findLeads(int limit) {
        return jdbcTemplate.query("""
            SELECT b.*, e.result_json FROM businesses b
            LEFT JOIN enrichment_results e ON e.place_id = b.place_id
            ORDER BY b.first_seen_at DESC, b.place_id
            LIMIT ?
            """, leadMapper(), limit);
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    private RowMapper<BusinessRecord> businessMapper() {
        return (rs, i) -> mapBusiness(rs);
    }

    private RowMapper<Lead> leadMapper() {
        return (rs, i) -> {
            String json = rs.getString("result_json");
            return Lead.of(mapBusiness(rs), json == null ? null : parseResult(json));
        };
    }

    private BusinessRecord mapBusiness(ResultSet rs) throws SQLException {
        return BusinessRecord.builder()
                .placeId(rs.getString("place_id"))
                .name(rs.getString("name"))
                .address(rs.getString("address"))
                .phone(rs.getString("phone"))
                .website(rs.getString("website"))
                .latitude(rs.getObject("latitude", Double.class))
                .longitude(rs.getObject("longitude", Double.class))
                .rating(rs.getObject("rating", Double.class))
                .reviewCount(rs.getObject("review_count", Integer.class))
                .categories(fromJson(rs.getString("categories")))
                .hoursJson(rs.getString("hours_json"))
                .sourceSearch(rs.getString("source_search"))
                .firstSeenAt(rs.getTimestamp("first_seen_at").toLocalDateTime())
                .build();
    }

    private String toJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise categories", e);
        }
    }

    private List<String> fromJson(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable categories payload, treating as empty: {}", e.getMessage());
            return List.of();
        }
    }

    private String resultJson(EnrichmentResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise enrichment result for " + result.placeId(), e);
        }
    }

    private EnrichmentResult parseResult(String json) {
        try {
            return objectMapper.readValue(json, EnrichmentResult.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt enrichment result payload", e);
        }
    }
}
