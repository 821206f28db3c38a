package com.leadintel.enricher.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the pipeline tables if they do not exist. Safe to run on every start-up.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaInitializer {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring lead store schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS businesses
            (
                place_id            VARCHAR(255) PRIMARY KEY,
                name                VARCHAR(500) NOT NULL,
                address             VARCHAR(1000),
                phone               VARCHAR(64),
                website             VARCHAR(1000),
                latitude            DOUBLE PRECISION,
                longitude           DOUBLE PRECISION,
                rating              DOUBLE PRECISION,
                review_count        INT,
                categories          VARCHAR(4000),
                hours_json          CLOB,
                source_search       VARCHAR(64),
                first_seen_at       TIMESTAMP NOT NULL,
                updated_at          TIMESTAMP NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS enrichment_results
            (
                place_id            VARCHAR(255) PRIMARY KEY,
                primary_email       VARCHAR(320),
                confidence          DOUBLE PRECISION,
                source              VARCHAR(64),
                enrichment_failed   BOOLEAN NOT NULL,
                enriched_at         TIMESTAMP NOT NULL,
                result_json         CLOB NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS enrichment_history
            (
                id                  BIGINT AUTO_INCREMENT PRIMARY KEY,
                place_id            VARCHAR(255) NOT NULL,
                enriched_at         TIMESTAMP NOT NULL,
                result_json         CLOB NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS dedup_index
            (
                place_id            VARCHAR(255) PRIMARY KEY,
                job_id              VARCHAR(64) NOT NULL,
                admitted_at         TIMESTAMP NOT NULL,
                processed           BOOLEAN DEFAULT FALSE NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS cost_events
            (
                id                  BIGINT AUTO_INCREMENT PRIMARY KEY,
                provider            VARCHAR(64) NOT NULL,
                endpoint            VARCHAR(128) NOT NULL,
                cost                DECIMAL(14,6) NOT NULL,
                event_time          TIMESTAMP NOT NULL,
                success             BOOLEAN NOT NULL,
                error_message       VARCHAR(2000)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS enrichment_cache
            (
                cache_key           VARCHAR(1000) PRIMARY KEY,
                result_json         CLOB NOT NULL,
                stored_at           TIMESTAMP NOT NULL,
                expires_at          TIMESTAMP NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS jobs
            (
                job_id              VARCHAR(64) PRIMARY KEY,
                batch_id            VARCHAR(64),
                kind                VARCHAR(16) NOT NULL,
                status              VARCHAR(16) NOT NULL,
                query               VARCHAR(500) NOT NULL,
                location            VARCHAR(500),
                max_results         INT NOT NULL,
                total_records       INT DEFAULT 0 NOT NULL,
                processed_records   INT DEFAULT 0 NOT NULL,
                skipped_records     INT DEFAULT 0 NOT NULL,
                created_at          TIMESTAMP NOT NULL,
                updated_at          TIMESTAMP NOT NULL,
                next_page_token     VARCHAR(255),
                last_processed_id   VARCHAR(255),
                error_message       VARCHAR(2000)
            )
        """);

        // stores created before skipped_records existed
        jdbcTemplate.execute("ALTER TABLE jobs ADD COLUMN IF NOT EXISTS skipped_records INT DEFAULT 0 NOT NULL");

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_cost_events_time ON cost_events(event_time)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_cost_events_provider ON cost_events(provider)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_dedup_job ON dedup_index(job_id, processed)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_jobs_batch ON jobs(batch_id)");

        log.info("Lead store schema ready.");
    }
}
