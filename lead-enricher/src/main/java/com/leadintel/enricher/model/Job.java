package com.leadintel.enricher.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each search + enrichment job for progress reporting and resume.
 * Stored in the jobs table.
 */
@Data
@Builder(toBuilder = true)
public class Job {

    private String jobId;           // 12-char hex
    private String batchId;         // shared by all rows of one batch upload, null for single jobs
    private JobKind kind;
    private JobStatus status;
    private String query;
    private String location;
    private int maxResults;
    private int totalRecords;       // records fetched so far
    private int processedRecords;   // admitted records that reached a final outcome
    private int skippedRecords;     // fetched records dropped as duplicate or invalid
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    // ── Checkpoint ───────────────────────────────────────────────────────────
    private String nextPageToken;   // null before the first page, "DONE" when pagination finished
    private String lastProcessedId; // last place id that finished processing

    private String errorMessage;    // null unless FAILED

    public static final String PAGES_DONE = "DONE";

    /** Share of fetched records that are settled, either processed or skipped. */
    public int progressPercent() {
        if (status == JobStatus.COMPLETED) return 100;
        int expected = Math.max(totalRecords, 1);
        return Math.min(99, (processedRecords + skippedRecords) * 100 / expected);
    }

    public SearchRequest toRequest() {
        return new SearchRequest(query, location, maxResults);
    }
}
