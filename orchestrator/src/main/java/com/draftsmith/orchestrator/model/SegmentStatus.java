package com.draftsmith.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Execution state of a single Segment.
 *
 * Transitions:
 *   PENDING → PROCESSING → COMPLETED | FAILED
 *   FAILED  → PROCESSING (re-attempted on retry)
 */
public enum SegmentStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
