package com.leadintel.enricher.model;

import java.time.Instant;

/**
 * Progress notification for an external observer. jobId is a batch id for batch-level events.
 */
public record ProgressEvent(String jobId, int progressPercent, JobStatus status, String detailMessage, Instant at) {
}
