package com.draftsmith.orchestrator.api.dto;

import com.draftsmith.orchestrator.model.Segment;
import com.draftsmith.orchestrator.model.SegmentStatus;
import com.draftsmith.orchestrator.model.Stage;

import java.time.Instant;

/**
 * Read-only view of a segment returned by GET /jobs/{id}/segments.
 */
public record SegmentResponse(
        int           index,
        Stage         stage,
        SegmentStatus status,
        boolean       passThrough,
        String        originalText,
        String        polishedText,
        String        enhancedText,
        Instant       completedAt
) {
    public static SegmentResponse from(Segment s) {
        return new SegmentResponse(
                s.getSegmentIndex(),
                s.getStage(),
                s.getStatus(),
                s.isTrivial(),
                s.getOriginalText(),
                s.getPolishedText(),
                s.getEnhancedText(),
                s.getCompletedAt()
        );
    }
}
