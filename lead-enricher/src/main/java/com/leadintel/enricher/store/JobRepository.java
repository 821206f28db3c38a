package com.leadintel.enricher.store;

import com.leadintel.enricher.model.Job;
import com.leadintel.enricher.model.JobKind;
import com.leadintel.enricher.model.JobStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JobRepository {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public void insert(Job job) {
        jdbcTemplate.update("""
            INSERT INTO jobs
            (job_id, batch_id, kind, status, query, location, max_results, total_records, processed_records,
             skipped_records, created_at, updated_at, next_page_token, last_processed_id, error_message)
            VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
            """,
                job.getJobId(), job.getBatchId(), job.getKind().name(), job.getStatus().name(),
                job.getQuery(), job.getLocation(), job.getMaxResults(),
                job.getTotalRecords(), job.getProcessedRecords(), job.getSkippedRecords(),
                Timestamp.valueOf(job.getCreatedAt()), Timestamp.valueOf(job.getUpdatedAt()),
                job.getNextPageToken(), job.getLastProcessedId(), job.getErrorMessage());
    }

    /** Persists status, counters and checkpoint in one statement. */
    public void update(Job job) {
        job.setUpdatedAt(LocalDateTime.now(clock));
        jdbcTemplate.update("""
            UPDATE jobs
            SET status = ?, total_records = ?, processed_records = ?, skipped_records = ?, updated_at = ?,
                next_page_token = ?, last_processed_id = ?, error_message = ?
            WHERE job_id = ?
            """,
                job.getStatus().name(), job.getTotalRecords(), job.getProcessedRecords(), job.getSkippedRecords(),
                Timestamp.valueOf(job.getUpdatedAt()), job.getNextPageToken(), job.getLastProcessedId(),
                job.getErrorMessage(), job.getJobId());
    }

    /**
     * Moves the job to {@code next} only if it is still in {@code expected}.
     *
     * @return false when another thread changed the status first
     */
    public boolean compareAndSetStatus(String jobId, JobStatus expected, JobStatus next) {
        return jdbcTemplate.update(
                "UPDATE jobs SET status = ?, updated_at = ? WHERE job_id = ? AND status = ?",
                next.name(), Timestamp.valueOf(LocalDateTime.now(clock)), jobId, expected.name()) == 1;
    }

    public Optional<Job> findById(String jobId) {
        return jdbcTemplate.query("SELECT * FROM jobs WHERE job_id = ?", jobMapper(), jobId)
                .stream().findFirst();
    }

    public List<Job> findByStatus(JobStatus... statuses) {
        String placeholders = String.join(",", Collections.nCopies(statuses.length, "?"));
        Object[] args = Arrays.stream(statuses).map(Enum::name).toArray();
        return jdbcTemplate.query(
                "SELECT * FROM jobs WHERE status IN (" + placeholders + ") ORDER BY created_at, job_id",
                jobMapper(), args);
    }

    public List<Job> findByBatch(String batchId) {
        return jdbcTemplate.query("SELECT * FROM jobs WHERE batch_id = ? ORDER BY created_at, job_id",
                jobMapper(), batchId);
    }

    public List<Job> findRecent(int limit) {
        return jdbcTemplate.query("SELECT * FROM jobs ORDER BY created_at DESC, job_id LIMIT ?", jobMapper(), limit);
    }

    private RowMapper<Job> jobMapper() {
        return (rs, i) -> Job.builder()
                .jobId(rs.getString("job_id"))
                .batchId(rs.getString("batch_id"))
                .kind(JobKind.valueOf(rs.getString("kind")))
                .status(JobStatus.valueOf(rs.getString("status")))
                .query(rs.getString("query"))
                .location(rs.getString("location"))
                .maxResults(rs.getInt("max_results"))
                .totalRecords(rs.getInt("total_records"))
                .processedRecords(rs.getInt("processed_records"))
                .skippedRecords(rs.getInt("skipped_records"))
                .createdAt(rs.getTimestamp("created_at").toLocalDateTime())
                .updatedAt(rs.getTimestamp("updated_at").toLocalDateTime())
                .nextPageToken(rs.getString("next_page_token"))
                .lastProcessedId(rs.getString("last_processed_id"))
                .errorMessage(rs.getString("error_message"))
                .build();
    }
}
