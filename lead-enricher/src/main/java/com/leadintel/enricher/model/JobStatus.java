package com.leadintel.enricher.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Job lifecycle: QUEUED -> RUNNING -> {COMPLETED, FAILED, CANCELLED}.
 *
 * RUNNING -> QUEUED is used when an interrupted job is picked up again, and
 * CANCELLED -> QUEUED when a cancelled job is explicitly resumed.
 */
public enum JobStatus {
    QUEUED, RUNNING, COMPLETED, FAILED, CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return allowedNext().contains(next);
    }

    private Set<JobStatus> allowedNext() {
        return switch (this) {
            case QUEUED -> EnumSet.of(RUNNING, CANCELLED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, CANCELLED, QUEUED);
            case CANCELLED -> EnumSet.of(QUEUED);
            case COMPLETED, FAILED -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
