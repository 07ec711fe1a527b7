package com.draftsmith.orchestrator.pipeline;

import com.draftsmith.orchestrator.model.JobStatus;

import java.util.UUID;

/**
 * How a single pipeline run ended.
 *
 * @param status             terminal status the run left the job in
 * @param error              persisted error text, null unless {@code FAILED} or {@code STOPPED}
 * @param failedSegmentIndex resume offset recorded by a segment failure, otherwise null
 */
public record RunOutcome(UUID jobId, JobStatus status, String error, Integer failedSegmentIndex) {

    public static RunOutcome completed(UUID jobId) {
        return new RunOutcome(jobId, JobStatus.COMPLETED, null, null);
    }

    public static RunOutcome stopped(UUID jobId) {
        return new RunOutcome(jobId, JobStatus.STOPPED, JobStoppedException.MESSAGE, null);
    }

    public static RunOutcome failed(UUID jobId, String error, Integer failedSegmentIndex) {
        return new RunOutcome(jobId, JobStatus.FAILED, error, failedSegmentIndex);
    }
}
