package com.draftsmith.orchestrator.pipeline;

/**
 * Unwinds a run that observed a stop request at a segment boundary.
 * Not an error: the job ends {@code STOPPED} and can be retried.
 */
public class JobStoppedException extends RuntimeException {

    public static final String MESSAGE = "Stopped by user";

    public JobStoppedException() {
        super(MESSAGE);
    }
}
