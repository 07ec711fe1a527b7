package com.draftsmith.orchestrator.repository;

import com.draftsmith.orchestrator.model.ChangeRecord;
import com.draftsmith.orchestrator.model.HistoryRecord;
import com.draftsmith.orchestrator.model.Job;
import com.draftsmith.orchestrator.model.JobStatus;
import com.draftsmith.orchestrator.model.Segment;
import com.draftsmith.orchestrator.model.Stage;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage operations the pipeline needs, independent of how they are persisted.
 *
 * The production adapter is {@link JpaPipelineStore}; tests substitute an
 * in-memory implementation so the runner can be exercised without a database.
 *
 * Save operations are snapshots: callers own the instances they pass in and
 * may keep mutating them afterwards.
 */
public interface PipelineStore {

    Job saveJob(Job job);

    Optional<Job> findJob(UUID jobId);

    List<Job> findJobsByStatus(JobStatus status);

    /**
     * Mark {@code jobId} stopped, but only if it is still queued or processing.
     * The status check and the write are atomic with respect to other writers.
     *
     * @return the stopped job, or empty if it is missing or no longer stoppable
     */
    Optional<Job> stopIfStoppable(UUID jobId, String reason);

    /** Segments of {@code jobId} in ordinal order; empty if the job was never segmented. */
    List<Segment> findSegments(UUID jobId);

    List<Segment> saveSegments(List<Segment> segments);

    Segment saveSegment(Segment segment);

    Optional<HistoryRecord> findCompressedHistory(UUID jobId, Stage stage);

    /** Upsert the compressed history for (job, stage). */
    HistoryRecord saveCompressedHistory(UUID jobId, Stage stage, String historyData,
                                        int characterCount, int coveredThrough);

    /** Upsert the audit entry for (job, segment, stage). */
    ChangeRecord saveChange(UUID jobId, int segmentIndex, Stage stage,
                            String beforeText, String afterText, String changesDetail);

    /** Audit entries of {@code jobId} ordered by segment ordinal. */
    List<ChangeRecord> findChanges(UUID jobId);
}
