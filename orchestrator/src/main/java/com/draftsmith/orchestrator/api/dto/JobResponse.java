package com.draftsmith.orchestrator.api.dto;

import com.draftsmith.orchestrator.model.Job;
import com.draftsmith.orchestrator.model.JobStatus;
import com.draftsmith.orchestrator.model.ProcessingMode;
import com.draftsmith.orchestrator.model.Stage;
import com.draftsmith.orchestrator.service.JobStatusSnapshot;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for job endpoints. Contains enough information for the
 * caller to poll progress. Model credentials are never included.
 */
public record JobResponse(
        UUID           id,
        JobStatus      status,
        ProcessingMode mode,
        Stage          currentStage,
        int            currentPosition,
        int            totalSegments,
        double         progress,
        String         errorMessage,
        Integer        failedSegmentIndex,
        Integer        queuePosition,
        Long           estimatedWaitSeconds,
        Instant        createdAt,
        Instant        updatedAt,
        Instant        completedAt
) {
    public static JobResponse from(JobStatusSnapshot s) {
        return new JobResponse(
                s.jobId(),
                s.status(),
                s.mode(),
                s.currentStage(),
                s.currentPosition(),
                s.totalSegments(),
                s.progress(),
                s.errorMessage(),
                s.failedSegmentIndex(),
                s.queuePosition(),
                s.estimatedWaitSeconds(),
                s.createdAt(),
                s.updatedAt(),
                s.completedAt()
        );
    }

    public static JobResponse from(Job job) {
        return from(JobStatusSnapshot.of(job, null));
    }
}
