package com.draftsmith.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a Job.
 *
 * Transitions:
 *   QUEUED → PROCESSING → COMPLETED | FAILED | STOPPED
 *   QUEUED → STOPPED                (stopped before admission)
 *   FAILED | STOPPED → QUEUED       (retry, resumes where the last run ended)
 */
public enum JobStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    STOPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isRetryable() {
        return this == FAILED || this == STOPPED;
    }

    public boolean isStoppable() {
        return this == QUEUED || this == PROCESSING;
    }
}
