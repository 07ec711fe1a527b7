package com.draftsmith.orchestrator.api;

import com.draftsmith.orchestrator.config.PipelineProperties;
import com.draftsmith.orchestrator.service.JobService;
import com.draftsmith.orchestrator.stream.PipelineEvent;
import com.draftsmith.orchestrator.stream.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges a job's event subscription to a server-sent-event connection.
 *
 * One task per connection polls the subscriber queue. Each event is sent as a
 * named SSE event with a JSON body; an idle poll sends a keep-alive comment.
 * The stream ends after a terminal job event, when the client goes away, or
 * when the broadcaster drops a subscriber that fell too far behind.
 */
@Component
public class EventStreamer {

    private static final Logger log = LoggerFactory.getLogger(EventStreamer.class);

    private final JobService      jobService;
    private final ExecutorService streamWorkers;
    private final Duration        pollInterval;

    public EventStreamer(JobService jobService,
                         @Qualifier("streamWorkers") ExecutorService streamWorkers,
                         PipelineProperties properties) {
        this.jobService    = jobService;
        this.streamWorkers = streamWorkers;
        this.pollInterval  = properties.getStreamPollInterval();
    }

    /** @throws com.draftsmith.orchestrator.service.JobNotFoundException before any stream is opened */
    public SseEmitter stream(UUID jobId) {
        Subscription subscription = jobService.subscribe(jobId);
        SseEmitter emitter = new SseEmitter(0L);   // no server-side timeout

        AtomicBoolean open = new AtomicBoolean(true);
        emitter.onCompletion(() -> open.set(false));
        emitter.onTimeout(() -> open.set(false));
        emitter.onError(e -> open.set(false));

        streamWorkers.execute(() -> pump(subscription, emitter, open));
        return emitter;
    }

    private void pump(Subscription subscription, SseEmitter emitter, AtomicBoolean open) {
        MDC.put("jobId", subscription.jobId().toString());
        try {
            while (open.get() && subscription.isActive()) {
                Optional<PipelineEvent> next = subscription.poll(pollInterval);
                if (next.isEmpty()) {
                    emitter.send(SseEmitter.event().comment("keep-alive"));
                    continue;
                }
                PipelineEvent event = next.get();
                emitter.send(SseEmitter.event()
                        .name(event.type().wireName())
                        .data(event, MediaType.APPLICATION_JSON));
                if (event.type().isTerminal()) {
                    break;
                }
            }
            if (!subscription.isActive()) {
                log.info("Subscriber {} was dropped by the broadcaster; closing stream", subscription.id());
            }
            emitter.complete();
        } catch (IOException e) {
            log.debug("Event stream client disconnected: {}", e.getMessage());
            emitter.completeWithError(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.complete();
        } finally {
            subscription.close();
            MDC.clear();
        }
    }
}
