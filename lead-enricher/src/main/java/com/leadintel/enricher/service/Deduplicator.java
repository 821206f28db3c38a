package com.leadintel.enricher.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Persistent identity index. A place id is admitted for enrichment at most once across
 * every job, including the job that first admitted it; the primary key on dedup_index
 * decides races (first writer wins). Records a job admitted but never finished are found
 * through {@code BusinessRepository.findUnprocessedForJob}, not through a second admission.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class Deduplicator {

    public enum Admission {
        /** First sighting, this job owns the record */
        ADMITTED,
        /** Already admitted, by this job or another */
        DUPLICATE
    }

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public Admission admit(String placeId, String jobId) {
        try {
            jdbcTemplate.update(
                    "INSERT INTO dedup_index (place_id, job_id, admitted_at, processed) VALUES (?,?,?,FALSE)",
                    placeId, jobId, Timestamp.valueOf(LocalDateTime.now(clock)));
            return Admission.ADMITTED;
        } catch (DuplicateKeyException e) {
            log.debug("Duplicate place {} skipped by job {}", placeId, jobId);
            return Admission.DUPLICATE;
        }
    }

    public void markProcessed(String placeId) {
        jdbcTemplate.update("UPDATE dedup_index SET processed = TRUE WHERE place_id = ?", placeId);
    }

    public boolean isKnown(String placeId) {
        Integer n = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM dedup_index WHERE place_id = ?", Integer.class, placeId);
        return n != null && n > 0;
    }
}
