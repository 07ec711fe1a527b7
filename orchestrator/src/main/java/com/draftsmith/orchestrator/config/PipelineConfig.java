package com.draftsmith.orchestrator.config;

import com.draftsmith.orchestrator.admission.AdmissionController;
import com.draftsmith.orchestrator.llm.ChatModelClient;
import com.draftsmith.orchestrator.llm.UnconfiguredChatModelClient;
import com.draftsmith.orchestrator.stream.EventBroadcaster;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared pipeline infrastructure: the admission gate, the event broadcaster
 * and the two worker pools.
 *
 * Pipeline workers are unbounded: a run waiting for admission
 * parks its thread, and the admission limit is what bounds real work.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public AdmissionController admissionController(PipelineProperties props, MeterRegistry meterRegistry) {
        AdmissionController admission =
                new AdmissionController(props.getMaxConcurrentJobs(), props.getAverageJobDuration());
        Gauge.builder("draftsmith.admission.active", admission, AdmissionController::activeCount)
                .description("Jobs currently holding an admission slot")
                .register(meterRegistry);
        Gauge.builder("draftsmith.admission.waiting", admission, AdmissionController::waitingCount)
                .description("Jobs waiting for an admission slot")
                .register(meterRegistry);
        Gauge.builder("draftsmith.admission.limit", admission, AdmissionController::limit)
                .register(meterRegistry);
        return admission;
    }

    @Bean
    public EventBroadcaster eventBroadcaster(PipelineProperties props) {
        return new EventBroadcaster(props.getSubscriberQueueCapacity());
    }

    @Bean(name = "pipelineWorkers", destroyMethod = "shutdownNow")
    public ExecutorService pipelineWorkers() {
        return Executors.newCachedThreadPool(namedThreads("pipeline-worker-"));
    }

    /** Pumps subscriber queues into SSE connections, one task per connection. */
    @Bean(name = "streamWorkers", destroyMethod = "shutdownNow")
    public ExecutorService streamWorkers() {
        return Executors.newCachedThreadPool(namedThreads("event-stream-"));
    }

    /**
     * Fallback used when the deploying application supplies no client;
     * every stage call then fails with NOT_CONFIGURED.
     */
    @Bean
    @ConditionalOnMissingBean(ChatModelClient.class)
    public ChatModelClient chatModelClient() {
        return new UnconfiguredChatModelClient();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
