package com.draftsmith.orchestrator.admission;

/**
 * Point-in-time view of the admission state.
 *
 * {@code position} (1-based) and {@code estimatedWaitSeconds} are only set
 * when the status was requested for a job that is currently waiting.
 */
public record AdmissionStatus(
        int     activeJobs,
        int     limit,
        int     queueLength,
        Integer position,
        Long    estimatedWaitSeconds
) {
    public boolean isWaiting() {
        return position != null;
    }
}
