package com.leadintel.enricher.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JobStatusTest {

    @Test
    void queuedMayStartOrBeCancelled() {
        assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.RUNNING)).isTrue();
        assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.CANCELLED)).isTrue();
        assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.COMPLETED)).isFalse();
    }

    @Test
    void runningEndsInAnyTerminalStateOrRequeues() {
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.COMPLETED)).isTrue();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.FAILED)).isTrue();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.CANCELLED)).isTrue();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.QUEUED)).isTrue();
    }

    @Test
    void completedAndFailedAreFinal() {
        for (JobStatus next : JobStatus.values()) {
            assertThat(JobStatus.COMPLETED.canTransitionTo(next)).isFalse();
            assertThat(JobStatus.FAILED.canTransitionTo(next)).isFalse();
        }
        assertThat(JobStatus.CANCELLED.canTransitionTo(JobStatus.QUEUED)).isTrue();
        assertThat(JobStatus.CANCELLED.isTerminal()).isTrue();
    }

    @Test
    void progressIsCappedUntilCompletion() {
        Job job = Job.builder().status(JobStatus.RUNNING).totalRecords(20).processedRecords(20).build();
        assertThat(job.progressPercent()).isEqualTo(99);

        job.setStatus(JobStatus.COMPLETED);
        assertThat(job.progressPercent()).isEqualTo(100);

        job.setStatus(JobStatus.RUNNING);
        job.setProcessedRecords(5);
        assertThat(job.progressPercent()).isEqualTo(25);
    }

    @Test
    void skippedRecordsCountTowardsProgress() {
        Job reimport = Job.builder().status(JobStatus.RUNNING).totalRecords(40).skippedRecords(20).build();
        assertThat(reimport.progressPercent()).isEqualTo(50);

        reimport.setProcessedRecords(10);
        assertThat(reimport.progressPercent()).isEqualTo(75);
    }
}
