package com.draftsmith.orchestrator.service;

import com.draftsmith.orchestrator.admission.AdmissionStatus;
import com.draftsmith.orchestrator.model.Job;
import com.draftsmith.orchestrator.model.JobStatus;
import com.draftsmith.orchestrator.model.ProcessingMode;
import com.draftsmith.orchestrator.model.Stage;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a job as last persisted, plus its place in the
 * admission queue while it is waiting.
 */
public record JobStatusSnapshot(
        UUID           jobId,
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
    public static JobStatusSnapshot of(Job job, AdmissionStatus admission) {
        boolean waiting = job.getStatus() == JobStatus.QUEUED && admission != null && admission.isWaiting();
        return new JobStatusSnapshot(
                job.getId(),
                job.getStatus(),
                job.getMode(),
                job.getCurrentStage(),
                job.getCurrentPosition(),
                job.getTotalSegments(),
                job.getProgress(),
                job.getErrorMessage(),
                job.getFailedSegmentIndex(),
                waiting ? admission.position() : null,
                waiting ? admission.estimatedWaitSeconds() : null,
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getCompletedAt());
    }
}
