package com.draftsmith.orchestrator.api.dto;

import com.draftsmith.orchestrator.model.ChangeRecord;
import com.draftsmith.orchestrator.model.Stage;

import java.time.Instant;
import java.util.Map;

/**
 * One audit entry returned by GET /jobs/{id}/changes.
 * {@code detail} is the stored change summary, or null if it could not be read.
 */
public record ChangeResponse(
        int                 segmentIndex,
        Stage               stage,
        String              beforeText,
        String              afterText,
        Map<String, Object> detail,
        Instant             updatedAt
) {
    public static ChangeResponse from(ChangeRecord c, Map<String, Object> detail) {
        return new ChangeResponse(
                c.getSegmentIndex(),
                c.getStage(),
                c.getBeforeText(),
                c.getAfterText(),
                detail,
                c.getUpdatedAt()
        );
    }
}
