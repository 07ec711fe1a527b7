package com.draftsmith.orchestrator.pipeline;

import com.draftsmith.orchestrator.admission.AdmissionController;
import com.draftsmith.orchestrator.config.PipelineProperties;
import com.draftsmith.orchestrator.llm.ChatMessage;
import com.draftsmith.orchestrator.llm.ChatModelClient;
import com.draftsmith.orchestrator.llm.ChatRequest;
import com.draftsmith.orchestrator.llm.ModelEndpoint;
import com.draftsmith.orchestrator.llm.StageCallFailedException;
import com.draftsmith.orchestrator.model.HistoryRecord;
import com.draftsmith.orchestrator.model.Job;
import com.draftsmith.orchestrator.model.JobStatus;
import com.draftsmith.orchestrator.model.Segment;
import com.draftsmith.orchestrator.model.SegmentStatus;
import com.draftsmith.orchestrator.model.Stage;
import com.draftsmith.orchestrator.repository.PipelineStore;
import com.draftsmith.orchestrator.stream.EventBroadcaster;
import com.draftsmith.orchestrator.stream.EventType;
import com.draftsmith.orchestrator.stream.PipelineEvent;
import com.draftsmith.orchestrator.text.Segmenter;
import com.draftsmith.orchestrator.text.TextMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one job through every stage of its processing mode.
 *
 * For a given job, a run:
 *   1. Waits for an admission slot (possibly for a long time)
 *   2. Segments the text on the first run; later runs reuse the stored segments
 *   3. For each stage, walks the segments in order from the resume offset:
 *        short segments pass through unchanged, segments that already carry
 *        this stage's output are skipped, the rest go to the model with the
 *        running history as context
 *   4. Compresses the history whenever it grows past the threshold
 *   5. Ends the job COMPLETED, FAILED (with the failing segment recorded as
 *      the resume offset) or STOPPED, and always gives the slot back
 *
 * The {@link Job} instance loaded at the start is the authoritative state for
 * the whole run; every change is written through the store so concurrent
 * readers see a recent snapshot.
 */
@Component
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    static final double TEMPERATURE = 0.7;

    private static final TypeReference<List<ChatMessage>> ENTRY_LIST_TYPE = new TypeReference<>() {};

    private final PipelineStore         store;
    private final AdmissionController   admission;
    private final EventBroadcaster      events;
    private final ChatModelClient       client;
    private final HistoryCompressor     compressor;
    private final StagePrompts          prompts;
    private final ModelEndpointResolver endpoints;
    private final PipelineProperties    properties;
    private final MeterRegistry         meterRegistry;
    private final ObjectMapper          objectMapper;

    public PipelineRunner(PipelineStore store,
                          AdmissionController admission,
                          EventBroadcaster events,
                          ChatModelClient client,
                          HistoryCompressor compressor,
                          StagePrompts prompts,
                          ModelEndpointResolver endpoints,
                          PipelineProperties properties,
                          MeterRegistry meterRegistry,
                          ObjectMapper objectMapper) {
        this.store         = store;
        this.admission     = admission;
        this.events        = events;
        this.client        = client;
        this.compressor    = compressor;
        this.prompts       = prompts;
        this.endpoints     = endpoints;
        this.properties    = properties;
        this.meterRegistry = meterRegistry;
        this.objectMapper  = objectMapper;
    }

    // ------------------------------------------------------------------
    // Entry point (called by PipelineSupervisor on a worker thread)
    // ------------------------------------------------------------------

    /**
     * Run the job to a terminal status. Never throws: every exit path is
     * persisted on the job and described by the returned outcome.
     */
    public RunOutcome run(UUID jobId, CancellationToken token) {
        MDC.put("jobId", jobId.toString());
        Job job = null;
        try {
            job = store.findJob(jobId)
                    .orElseThrow(() -> new IllegalStateException("Job not found: " + jobId));

            if (!admission.acquire(jobId, token::isCancellationRequested)) {
                throw new JobStoppedException();
            }
            token.throwIfCancellationRequested();

            job.setStatus(JobStatus.PROCESSING);
            store.saveJob(job);
            events.publish(jobId, PipelineEvent.of(EventType.JOB_STARTED, jobId, "Processing started"));
            log.info("Job {} admitted, mode={}", jobId, job.getMode().wireName());

            List<Segment> segments = prepareSegments(job);
            for (Stage stage : job.getMode().stages()) {
                runStage(job, stage, segments, token);
            }

            job.setStatus(JobStatus.COMPLETED);
            job.setProgress(100.0);
            job.setCurrentPosition(segments.size());
            job.setFailedSegmentIndex(null);
            job.setErrorMessage(null);
            job.setCompletedAt(Instant.now());
            store.saveJob(job);
            events.publish(jobId, PipelineEvent.of(EventType.JOB_COMPLETED, jobId, "Processing completed"));
            log.info("Job {} COMPLETED ({} segments)", jobId, segments.size());
            return RunOutcome.completed(jobId);

        } catch (JobStoppedException e) {
            return markStopped(job, jobId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return markStopped(job, jobId);
        } catch (SegmentFailedException e) {
            String error = truncate(e.getMessage());
            log.error("Job {} FAILED at segment {} ({}): {}",
                    jobId, e.getSegmentIndex(), e.getStage().wireName(), error);
            markFailed(job, error, e.getSegmentIndex());
            return RunOutcome.failed(jobId, error, e.getSegmentIndex());
        } catch (RuntimeException e) {
            String error = truncate(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            log.error("Job {} FAILED unexpectedly", jobId, e);
            Integer failedIndex = job != null ? job.getFailedSegmentIndex() : null;
            markFailed(job, error, failedIndex);
            return RunOutcome.failed(jobId, error, failedIndex);
        } finally {
            admission.release(jobId);
            // Pooled worker threads are reused; never let one job's MDC leak into the next.
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // Segmentation
    // ------------------------------------------------------------------

    private List<Segment> prepareSegments(Job job) {
        List<Segment> existing = store.findSegments(job.getId());
        if (!existing.isEmpty()) {
            log.info("Job {} resuming with {} existing segments", job.getId(), existing.size());
            job.setTotalSegments(existing.size());
            store.saveJob(job);
            return new ArrayList<>(existing);
        }

        List<String> texts = Segmenter.segment(job.getOriginalText(), properties.getSegmentMaxSize());
        List<Segment> segments = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            segments.add(new Segment(job.getId(), i, job.getMode().firstStage(), texts.get(i)));
        }
        store.saveSegments(segments);
        job.setTotalSegments(segments.size());
        store.saveJob(job);
        log.info("Job {} split into {} segments", job.getId(), segments.size());
        return segments;
    }

    // ------------------------------------------------------------------
    // Stage loop
    // ------------------------------------------------------------------

    private void runStage(Job job, Stage stage, List<Segment> segments, CancellationToken token) {
        MDC.put("stage", stage.wireName());
        UUID jobId = job.getId();
        int  total = segments.size();
        int  start = job.getFailedSegmentIndex() == null
                ? 0
                : Math.min(Math.max(job.getFailedSegmentIndex(), 0), total);

        job.setCurrentStage(stage);
        store.saveJob(job);
        events.publish(jobId, PipelineEvent.stageStarted(jobId, stage.wireName()));
        log.info("Stage {} starting at segment {}/{}", stage.wireName(), start, total);

        int threshold = properties.getTrivialSegmentThreshold();

        // Built right before the first real model call of this stage.
        HistoryContext history = null;

        for (int idx = start; idx < total; idx++) {
            token.throwIfCancellationRequested();
            Segment segment = segments.get(idx);

            double progress = job.getMode().progress(stage, idx, total);
            job.setCurrentPosition(idx);
            job.setProgress(progress);
            store.saveJob(job);
            events.publish(jobId, PipelineEvent.progress(jobId, stage.wireName(), idx, progress));

            if (TextMetrics.measure(segment.getOriginalText()) < threshold) {
                if (!segment.isTrivial()) {
                    segment.markPassThrough(stage);
                    store.saveSegment(segment);
                }
                events.publish(jobId, PipelineEvent.segmentSkipped(jobId, stage.wireName(), idx, "pass-through"));
                continue;
            }

            String existing = stage.outputOf(segment);
            if (existing != null) {
                if (segment.getStatus() != SegmentStatus.COMPLETED) {
                    // Left FAILED by a compression failure after its output was written.
                    segment.setStatus(SegmentStatus.COMPLETED);
                    store.saveSegment(segment);
                }
                if (history != null) {
                    history.append(existing);
                }
                events.publish(jobId, PipelineEvent.segmentSkipped(jobId, stage.wireName(), idx, "already processed"));
                continue;
            }

            if (history == null) {
                history = rebuildHistory(jobId, stage, segments, idx);
            }

            String output = transform(job, stage, segment, history);
            history.append(output);

            if (history.exceeds(properties.getHistoryCompressionThreshold())) {
                compressHistory(jobId, stage, segment, history);
            }
        }

        if (job.getFailedSegmentIndex() != null) {
            job.setFailedSegmentIndex(null);
            store.saveJob(job);
        }
        log.info("Stage {} complete", stage.wireName());
        MDC.remove("stage");
    }

    /**
     * One model call for one segment. The segment is left FAILED and the
     * error rethrown as {@link SegmentFailedException} on any failure.
     */
    private String transform(Job job, Stage stage, Segment segment, HistoryContext history) {
        int    idx   = segment.getSegmentIndex();
        String input = stage.inputOf(segment);

        segment.setStatus(SegmentStatus.PROCESSING);
        segment.setStage(stage);
        store.saveSegment(segment);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        String output;
        try {
            ModelEndpoint endpoint = endpoints.resolve(job, stage);
            log.debug("Segment {} -> {} (history entries={}, size={})",
                    idx, endpoint, history.entries().size(), history.size());
            output = client.complete(new ChatRequest(
                    endpoint,
                    prompts.transformationMessages(history.entries(), stage, input),
                    TEMPERATURE));
            if (output == null) {
                throw StageCallFailedException.missingContent("content");
            }
        } catch (RuntimeException e) {
            status = e instanceof StageCallFailedException sc ? sc.getKind().name().toLowerCase() : "error";
            segment.setStatus(SegmentStatus.FAILED);
            store.saveSegment(segment);
            throw new SegmentFailedException(idx, stage, e);
        } finally {
            sample.stop(meterRegistry.timer("draftsmith.segment.duration",
                    "stage", stage.wireName(), "status", status));
            meterRegistry.counter("draftsmith.segment.calls",
                    "stage", stage.wireName(), "status", status).increment();
        }

        stage.writeOutput(segment, output);
        segment.setStatus(SegmentStatus.COMPLETED);
        segment.setCompletedAt(Instant.now());
        store.saveSegment(segment);

        recordChange(job.getId(), stage, idx, input, output);
        events.publish(job.getId(), PipelineEvent.segmentCompleted(job.getId(), stage.wireName(), idx, output));
        return output;
    }

    // ------------------------------------------------------------------
    // History
    // ------------------------------------------------------------------

    /**
     * Context for the first model call of a (re)started stage at {@code idx}.
     *
     * Seeds from the persisted summary when it covers only segments before
     * {@code idx}, then adds the raw outputs of the later non-trivial segments.
     * Raw entries folded into an earlier summary cannot be recovered exactly.
     */
    private HistoryContext rebuildHistory(UUID jobId, Stage stage, List<Segment> segments, int idx) {
        HistoryContext history = HistoryContext.empty();
        int from = 0;

        Optional<HistoryRecord> persisted = store.findCompressedHistory(jobId, stage);
        if (persisted.isPresent() && persisted.get().getCoveredThrough() < idx) {
            try {
                List<ChatMessage> entries = objectMapper.readValue(persisted.get().getHistoryData(), ENTRY_LIST_TYPE);
                history = HistoryContext.seededWith(entries);
                from = persisted.get().getCoveredThrough() + 1;
            } catch (Exception e) {
                log.warn("Could not deserialise compressed history for job {} stage {}, rebuilding from segments: {}",
                        jobId, stage.wireName(), e.getMessage());
            }
        }

        for (int i = from; i < idx; i++) {
            Segment earlier = segments.get(i);
            String output = stage.outputOf(earlier);
            if (!earlier.isTrivial() && output != null) {
                history.append(output);
            }
        }
        if (!history.isEmpty()) {
            log.info("History for stage {} rebuilt before segment {}: {} entries, size {}",
                    stage.wireName(), idx, history.entries().size(), history.size());
        }
        return history;
    }

    private void compressHistory(UUID jobId, Stage stage, Segment segment, HistoryContext history) {
        int idx    = segment.getSegmentIndex();
        int before = history.size();
        try {
            ChatMessage summary = compressor.compress(history.entries(), stage, endpoints.compressionEndpoint());
            history.replaceWithSummary(summary);
        } catch (RuntimeException e) {
            // The output is already stored; a retry re-marks the segment COMPLETED and moves on.
            segment.setStatus(SegmentStatus.FAILED);
            store.saveSegment(segment);
            throw new SegmentFailedException(idx, stage, e);
        }
        log.info("History compressed for stage {} after segment {}: size {} -> {}",
                stage.wireName(), idx, before, history.size());

        persistHistory(jobId, stage, history, idx);
        meterRegistry.counter("draftsmith.history.compressions", "stage", stage.wireName()).increment();
        events.publish(jobId, PipelineEvent.historyCompressed(jobId, stage.wireName(), history.size()));
    }

    /**
     * Serialise and save the compressed history. A serialisation failure is
     * logged and skipped; the next resume rebuilds the history from segments.
     */
    private void persistHistory(UUID jobId, Stage stage, HistoryContext history, int coveredThrough) {
        String json;
        try {
            json = objectMapper.writeValueAsString(history.entries());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise compressed history for job {} stage {}: {}",
                    jobId, stage.wireName(), e.getMessage());
            return;
        }
        store.saveCompressedHistory(jobId, stage, json, history.size(), coveredThrough);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void recordChange(UUID jobId, Stage stage, int idx, String before, String after) {
        String detail = null;
        try {
            detail = objectMapper.writeValueAsString(ChangeSummary.of(before, after));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise change summary for segment {}: {}", idx, e.getMessage());
        }
        store.saveChange(jobId, idx, stage, before, after, detail);
    }

    private RunOutcome markStopped(Job job, UUID jobId) {
        log.info("Job {} STOPPED", jobId);
        if (job != null) {
            job.setStatus(JobStatus.STOPPED);
            job.setErrorMessage(JobStoppedException.MESSAGE);
            try {
                store.saveJob(job);
            } catch (RuntimeException e) {
                log.error("Could not persist stop of job {}: {}", jobId, e.getMessage());
            }
        }
        events.publish(jobId, PipelineEvent.of(EventType.JOB_STOPPED, jobId, JobStoppedException.MESSAGE));
        return RunOutcome.stopped(jobId);
    }

    private void markFailed(Job job, String error, Integer failedSegmentIndex) {
        if (job == null) return;
        job.setStatus(JobStatus.FAILED);
        job.setErrorMessage(error);
        job.setFailedSegmentIndex(failedSegmentIndex);
        try {
            store.saveJob(job);
        } catch (RuntimeException e) {
            log.error("Could not persist failure of job {}: {}", job.getId(), e.getMessage());
        }
        events.publish(job.getId(), PipelineEvent.of(EventType.JOB_FAILED, job.getId(), error));
    }

    String truncate(String message) {
        int limit = properties.getErrorMessageLimit();
        if (message == null || message.length() <= limit) return message;
        return message.substring(0, limit) + "...";
    }
}
