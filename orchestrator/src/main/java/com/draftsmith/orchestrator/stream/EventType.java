package com.draftsmith.orchestrator.stream;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of events a job publishes to its live subscribers.
 * The wire name doubles as the SSE event name.
 */
public enum EventType {
    JOB_QUEUED("job_queued"),
    JOB_STARTED("job_started"),
    STAGE_STARTED("stage_started"),
    PROGRESS("progress"),
    SEGMENT_COMPLETED("segment_completed"),
    SEGMENT_SKIPPED("segment_skipped"),
    HISTORY_COMPRESSED("history_compressed"),
    JOB_COMPLETED("job_completed"),
    JOB_FAILED("job_failed"),
    JOB_STOPPED("job_stopped");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == JOB_COMPLETED || this == JOB_FAILED || this == JOB_STOPPED;
    }
}
