package com.draftsmith.orchestrator.pipeline;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * A live pipeline run: its stop signal and the future of its outcome.
 */
public record RunHandle(UUID jobId,
                        CancellationToken token,
                        CompletableFuture<RunOutcome> outcome,
                        Instant startedAt) {

    public boolean isDone() {
        return outcome.isDone();
    }
}
