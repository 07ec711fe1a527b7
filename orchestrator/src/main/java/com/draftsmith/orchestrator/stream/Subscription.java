package com.draftsmith.orchestrator.stream;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One live listener on a job's events, backed by a bounded queue.
 *
 * The producer side only ever calls {@link #offer}, which never blocks.
 * The consumer polls with a timeout and should stop once
 * {@link #isActive()} turns false (it was dropped or closed).
 */
public final class Subscription implements AutoCloseable {

    private final UUID id = UUID.randomUUID();
    private final UUID jobId;
    private final BlockingQueue<PipelineEvent> queue;
    private final EventBroadcaster owner;
    private volatile boolean active = true;

    Subscription(UUID jobId, int capacity, EventBroadcaster owner) {
        this.jobId = jobId;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.owner = owner;
    }

    public UUID id()    { return id; }
    public UUID jobId() { return jobId; }

    public boolean isActive() {
        return active;
    }

    /**
     * Wait up to {@code timeout} for the next event.
     *
     * @return the event, or empty when the wait timed out
     */
    public Optional<PipelineEvent> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /** Number of events queued and not yet consumed. */
    public int pending() {
        return queue.size();
    }

    /** Unsubscribe. Idempotent. */
    @Override
    public void close() {
        owner.unsubscribe(jobId, this);
    }

    boolean offer(PipelineEvent event) {
        return active && queue.offer(event);
    }

    void deactivate() {
        active = false;
    }
}
