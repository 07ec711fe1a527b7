package com.draftsmith.orchestrator.pipeline;

/**
 * Cooperative stop signal for one pipeline run.
 *
 * Set by the job-control side, checked by the runner at segment boundaries.
 * An in-flight model call is never interrupted.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    /** @throws JobStoppedException if {@link #cancel()} has been called */
    public void throwIfCancellationRequested() {
        if (cancelled) {
            throw new JobStoppedException();
        }
    }
}
