package com.leadintel.enricher.service;

import com.leadintel.enricher.budget.MutableClock;
import com.leadintel.enricher.store.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.leadintel.enricher.service.Deduplicator.Admission.ADMITTED;
import static com.leadintel.enricher.service.Deduplicator.Admission.DUPLICATE;
import static org.assertj.core.api.Assertions.assertThat;

class DeduplicatorTest {

    private JdbcTemplate jdbc;
    private Deduplicator deduplicator;

    @BeforeEach
    void setUp() {
        jdbc = TestDatabase.fresh();
        deduplicator = new Deduplicator(jdbc, new MutableClock(Instant.parse("2026-03-04T10:00:00Z")));
    }

    @Test
    void firstSightingIsAdmitted() {
        assertThat(deduplicator.isKnown("p1")).isFalse();
        assertThat(deduplicator.admit("p1", "job-a")).isEqualTo(ADMITTED);
        assertThat(deduplicator.isKnown("p1")).isTrue();
        assertThat(jdbc.queryForObject("SELECT admitted_at FROM dedup_index WHERE place_id = ?",
                Timestamp.class, "p1").toLocalDateTime()).isEqualTo(LocalDateTime.of(2026, 3, 4, 10, 0));
    }

    @Test
    @DisplayName("another job never gets a place that was already admitted")
    void otherJobSeesDuplicate() {
        deduplicator.admit("p1", "job-a");

        assertThat(deduplicator.admit("p1", "job-b")).isEqualTo(DUPLICATE);

        deduplicator.markProcessed("p1");
        assertThat(deduplicator.admit("p1", "job-b")).isEqualTo(DUPLICATE);
    }

    @Test
    @DisplayName("the owning job cannot admit the same place a second time")
    void sameJobSeesDuplicate() {
        deduplicator.admit("p1", "job-a");

        assertThat(deduplicator.admit("p1", "job-a")).isEqualTo(DUPLICATE);

        deduplicator.markProcessed("p1");
        assertThat(deduplicator.admit("p1", "job-a")).isEqualTo(DUPLICATE);
    }

    @Test
    @DisplayName("racing jobs: exactly one admission wins")
    void concurrentAdmission() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Deduplicator.Admission>> calls = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String job = "job-" + i;
                calls.add(() -> deduplicator.admit("contested", job));
            }
            long admitted = 0;
            for (Future<Deduplicator.Admission> f : pool.invokeAll(calls)) {
                if (f.get() == ADMITTED) admitted++;
            }
            assertThat(admitted).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
