package com.draftsmith.orchestrator.stream;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.UUID;

/**
 * One progress or content notification for a job.
 * Only the fields relevant to the event type are populated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineEvent(
        EventType type,
        UUID      jobId,
        String    stage,
        Integer   segmentIndex,
        String    content,
        Double    progress,
        String    message,
        Instant   timestamp
) {

    public static PipelineEvent of(EventType type, UUID jobId, String message) {
        return new PipelineEvent(type, jobId, null, null, null, null, message, Instant.now());
    }

    public static PipelineEvent stageStarted(UUID jobId, String stage) {
        return new PipelineEvent(EventType.STAGE_STARTED, jobId, stage, null, null, null, null, Instant.now());
    }

    public static PipelineEvent progress(UUID jobId, String stage, int segmentIndex, double progress) {
        return new PipelineEvent(EventType.PROGRESS, jobId, stage, segmentIndex, null, progress, null, Instant.now());
    }

    public static PipelineEvent segmentCompleted(UUID jobId, String stage, int segmentIndex, String text) {
        return new PipelineEvent(EventType.SEGMENT_COMPLETED, jobId, stage, segmentIndex, text, null, null, Instant.now());
    }

    public static PipelineEvent segmentSkipped(UUID jobId, String stage, int segmentIndex, String reason) {
        return new PipelineEvent(EventType.SEGMENT_SKIPPED, jobId, stage, segmentIndex, null, null, reason, Instant.now());
    }

    public static PipelineEvent historyCompressed(UUID jobId, String stage, int newSize) {
        return new PipelineEvent(EventType.HISTORY_COMPRESSED, jobId, stage, null, null, null,
                "History compressed for stage " + stage + " (new size " + newSize + ")", Instant.now());
    }
}
