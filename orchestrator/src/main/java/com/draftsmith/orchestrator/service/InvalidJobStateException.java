package com.draftsmith.orchestrator.service;

import com.draftsmith.orchestrator.model.JobStatus;

import java.util.UUID;

/**
 * A job-control operation is not allowed in the job's current status.
 */
public class InvalidJobStateException extends RuntimeException {

    private final UUID      jobId;
    private final JobStatus status;

    public InvalidJobStateException(UUID jobId, JobStatus status, String message) {
        super(message);
        this.jobId  = jobId;
        this.status = status;
    }

    public UUID      getJobId()  { return jobId; }
    public JobStatus getStatus() { return status; }
}
