package com.draftsmith.orchestrator.admission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Bounds how many jobs may run their pipeline at the same time.
 *
 * Jobs that cannot be admitted wait in a FIFO queue. Whenever capacity frees
 * up (release, limit increase) waiting jobs are promoted in arrival order
 * until the admitted set is full again, and every waiter is woken to
 * re-check its own admission.
 *
 * <p>All state lives behind a single {@link ReentrantLock}; waiters block on
 * a {@link Condition} of that lock, so a wake-up can never race a state
 * change. There is no timeout: a waiter stays queued until it is promoted
 * or withdrawn.
 *
 * <p>Invariants:
 * <ul>
 *   <li>{@code admitted.size() <= limit} at every observable instant.</li>
 *   <li>A job id is in at most one of {admitted, waiting}.</li>
 *   <li>No id is promoted ahead of an id that started waiting earlier.</li>
 * </ul>
 */
public class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private final ReentrantLock lock    = new ReentrantLock();
    private final Condition     changed = lock.newCondition();

    private final Set<UUID>   admitted = new LinkedHashSet<>();
    private final Deque<UUID> waiting  = new ArrayDeque<>();

    private final Duration averageJobDuration;
    private int limit;

    public AdmissionController(int limit, Duration averageJobDuration) {
        this.limit              = Math.max(1, limit);
        this.averageJobDuration = averageJobDuration;
    }

    // ------------------------------------------------------------------
    // Acquire / release
    // ------------------------------------------------------------------

    /**
     * Block until {@code jobId} holds a slot.
     *
     * @return {@code true} once admitted, {@code false} if the job was withdrawn while waiting
     */
    public boolean acquire(UUID jobId) throws InterruptedException {
        return acquire(jobId, () -> false);
    }

    /**
     * Block until {@code jobId} holds a slot, giving up if {@code abandoned}
     * reports true before admission.
     *
     * {@code abandoned} is evaluated under the lock before queueing and after
     * every wake-up. Callers that flip it must follow with {@link #withdraw}
     * so a sleeping waiter is woken.
     *
     * @return {@code true} once admitted, {@code false} if abandoned or withdrawn
     */
    public boolean acquire(UUID jobId, BooleanSupplier abandoned) throws InterruptedException {
        lock.lock();
        try {
            if (admitted.contains(jobId)) {
                return true;
            }
            if (abandoned.getAsBoolean()) {
                waiting.remove(jobId);
                return false;
            }
            if (admitted.size() < limit && waiting.isEmpty()) {
                admitted.add(jobId);
                log.info("Job {} admitted immediately ({}/{} slots in use)", jobId, admitted.size(), limit);
                return true;
            }

            if (!waiting.contains(jobId)) {
                waiting.addLast(jobId);
            }
            log.info("Job {} waiting for a slot (queue position {}, {}/{} slots in use)",
                    jobId, positionOf(jobId), admitted.size(), limit);

            try {
                while (!admitted.contains(jobId) && waiting.contains(jobId)) {
                    if (abandoned.getAsBoolean()) {
                        waiting.remove(jobId);
                        log.info("Job {} abandoned its place in the admission queue", jobId);
                        return false;
                    }
                    changed.await();
                }
            } catch (InterruptedException e) {
                // Give the slot back if we were promoted in the same instant.
                if (!waiting.remove(jobId) && admitted.remove(jobId)) {
                    promoteWaiting();
                    changed.signalAll();
                }
                throw e;
            }
            return admitted.contains(jobId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop {@code jobId} from the admitted set and/or the wait queue, then
     * promote waiters in FIFO order and wake everyone.
     */
    public void release(UUID jobId) {
        lock.lock();
        try {
            boolean held   = admitted.remove(jobId);
            boolean queued = waiting.remove(jobId);
            List<UUID> promoted = promoteWaiting();
            changed.signalAll();
            if (held || queued) {
                log.info("Job {} released its {} ({}/{} slots in use, {} waiting, promoted={})",
                        jobId, held ? "slot" : "queue place", admitted.size(), limit, waiting.size(), promoted);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove a job from the wait queue without touching the admitted set.
     * A job already holding a slot is unaffected.
     *
     * @return {@code true} if the job was waiting
     */
    public boolean withdraw(UUID jobId) {
        lock.lock();
        try {
            boolean removed = waiting.remove(jobId);
            changed.signalAll();
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /** Change capacity at runtime (minimum 1) and promote waiters into any new room. */
    public void updateLimit(int newLimit) {
        lock.lock();
        try {
            int previous = limit;
            limit = Math.max(1, newLimit);
            List<UUID> promoted = promoteWaiting();
            changed.signalAll();
            log.info("Admission limit changed {} -> {} (promoted={})", previous, limit, promoted);
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public AdmissionStatus status() {
        return status(null);
    }

    /**
     * @param jobId optional; when it is waiting, its 1-based position and an
     *              estimated wait (position x average job duration) are included
     */
    public AdmissionStatus status(UUID jobId) {
        lock.lock();
        try {
            Integer position = null;
            Long    wait     = null;
            if (jobId != null && waiting.contains(jobId)) {
                position = positionOf(jobId);
                wait     = position * averageJobDuration.toSeconds();
            }
            return new AdmissionStatus(admitted.size(), limit, waiting.size(), position, wait);
        } finally {
            lock.unlock();
        }
    }

    public boolean isAdmitted(UUID jobId) {
        lock.lock();
        try {
            return admitted.contains(jobId);
        } finally {
            lock.unlock();
        }
    }

    public int activeCount() {
        lock.lock();
        try {
            return admitted.size();
        } finally {
            lock.unlock();
        }
    }

    public int waitingCount() {
        lock.lock();
        try {
            return waiting.size();
        } finally {
            lock.unlock();
        }
    }

    public int limit() {
        lock.lock();
        try {
            return limit;
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Helpers (caller holds the lock)
    // ------------------------------------------------------------------

    private List<UUID> promoteWaiting() {
        List<UUID> promoted = new ArrayList<>();
        while (!waiting.isEmpty() && admitted.size() < limit) {
            UUID next = waiting.pollFirst();
            admitted.add(next);
            promoted.add(next);
        }
        return promoted;
    }

    private int positionOf(UUID jobId) {
        int position = 1;
        for (UUID id : waiting) {
            if (id.equals(jobId)) return position;
            position++;
        }
        return -1;
    }
}
