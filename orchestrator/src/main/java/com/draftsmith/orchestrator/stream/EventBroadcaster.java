package com.draftsmith.orchestrator.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Per-job multicast of {@link PipelineEvent}s to live subscribers.
 *
 * Delivery is best-effort and at-most-once: an event reaches only the
 * subscribers connected when it is published (no replay), and a subscriber
 * whose queue is full is dropped rather than allowed to stall the producer.
 *
 * The subscriber map has its own monitor, independent of admission control.
 */
public class EventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private final Map<UUID, List<Subscription>> subscribers = new HashMap<>();
    private final int queueCapacity;

    public EventBroadcaster(int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be at least 1");
        }
        this.queueCapacity = queueCapacity;
    }

    public Subscription subscribe(UUID jobId) {
        Subscription subscription = new Subscription(jobId, queueCapacity, this);
        synchronized (subscribers) {
            subscribers.computeIfAbsent(jobId, id -> new ArrayList<>()).add(subscription);
        }
        log.debug("Subscriber {} attached to job {}", subscription.id(), jobId);
        return subscription;
    }

    public void unsubscribe(UUID jobId, Subscription subscription) {
        subscription.deactivate();
        synchronized (subscribers) {
            List<Subscription> list = subscribers.get(jobId);
            if (list == null) return;
            list.remove(subscription);
            if (list.isEmpty()) subscribers.remove(jobId);
        }
        log.debug("Subscriber {} detached from job {}", subscription.id(), jobId);
    }

    /**
     * Enqueue {@code event} on every current subscriber of {@code jobId}
     * without blocking. Subscribers that cannot accept it are dropped.
     */
    public void publish(UUID jobId, PipelineEvent event) {
        List<Subscription> targets;
        synchronized (subscribers) {
            List<Subscription> list = subscribers.get(jobId);
            targets = list == null ? List.of() : new ArrayList<>(list);
        }

        if (targets.isEmpty()) {
            if (event.type() != EventType.PROGRESS) {
                log.debug("No subscribers for job {}, event {} not delivered", jobId, event.type().wireName());
            }
            return;
        }

        List<Subscription> failed = new ArrayList<>();
        for (Subscription target : targets) {
            try {
                if (!target.offer(event)) failed.add(target);
            } catch (RuntimeException e) {
                log.warn("Could not enqueue event for subscriber {} of job {}: {}",
                        target.id(), jobId, e.getMessage());
                failed.add(target);
            }
        }

        for (Subscription dropped : failed) {
            log.warn("Dropping subscriber {} of job {} (queue full or closed)", dropped.id(), jobId);
            unsubscribe(jobId, dropped);
        }
    }

    public int subscriberCount(UUID jobId) {
        synchronized (subscribers) {
            List<Subscription> list = subscribers.get(jobId);
            return list == null ? 0 : list.size();
        }
    }
}
