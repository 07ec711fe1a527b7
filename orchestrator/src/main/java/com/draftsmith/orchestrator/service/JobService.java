package com.draftsmith.orchestrator.service;

import com.draftsmith.orchestrator.admission.AdmissionController;
import com.draftsmith.orchestrator.admission.AdmissionStatus;
import com.draftsmith.orchestrator.model.ChangeRecord;
import com.draftsmith.orchestrator.model.Job;
import com.draftsmith.orchestrator.model.JobStatus;
import com.draftsmith.orchestrator.model.ModelOverride;
import com.draftsmith.orchestrator.model.ProcessingMode;
import com.draftsmith.orchestrator.model.Segment;
import com.draftsmith.orchestrator.model.Stage;
import com.draftsmith.orchestrator.pipeline.JobStoppedException;
import com.draftsmith.orchestrator.pipeline.PipelineSupervisor;
import com.draftsmith.orchestrator.repository.PipelineStore;
import com.draftsmith.orchestrator.stream.EventBroadcaster;
import com.draftsmith.orchestrator.stream.EventType;
import com.draftsmith.orchestrator.stream.PipelineEvent;
import com.draftsmith.orchestrator.stream.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Job-control façade: submission, status, live events, retry and stop.
 *
 * Every method is safe to call while a run for the same job is in flight.
 * Only the run writes job progress; this class writes a job only when no run
 * owns it (submission, retry, and stopping a job whose run is gone).
 *
 * Methods are deliberately not @Transactional: a job saved here must be
 * committed before the worker thread launched right after it reads it back.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    static final String RETRY_NOTE = "[retrying] previous failure: ";

    private final PipelineStore       store;
    private final PipelineSupervisor  supervisor;
    private final AdmissionController admission;
    private final EventBroadcaster    events;

    public JobService(PipelineStore store,
                      PipelineSupervisor supervisor,
                      AdmissionController admission,
                      EventBroadcaster events) {
        this.store      = store;
        this.supervisor = supervisor;
        this.admission  = admission;
        this.events     = events;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Validate and persist a new job, then launch its run.
     *
     * @param modeName  wire name of the processing mode
     * @param overrides optional per-stage model configuration; may be null
     * @throws com.draftsmith.orchestrator.model.UnknownProcessingModeException for an unknown mode
     * @throws IllegalArgumentException if {@code text} is blank
     */
    public Job submit(String text, String modeName, Map<Stage, ModelOverride> overrides) {
        ProcessingMode mode = ProcessingMode.fromWireName(modeName);
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text to process must not be blank");
        }

        Job job = new Job(text, mode);
        if (overrides != null) {
            overrides.forEach((stage, override) -> {
                if (override != null && !override.isEmpty()) {
                    job.setOverride(stage, override);
                }
            });
        }
        store.saveJob(job);
        events.publish(job.getId(), PipelineEvent.of(EventType.JOB_QUEUED, job.getId(), "Job queued"));
        supervisor.launch(job.getId());
        log.info("Job {} submitted (mode={}, {} chars)", job.getId(), mode.wireName(), text.length());
        return job;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<Job> findById(UUID jobId) {
        return store.findJob(jobId);
    }

    public JobStatusSnapshot getStatus(UUID jobId) {
        Job job = require(jobId);
        return JobStatusSnapshot.of(job, admission.status(jobId));
    }

    public List<Segment> segments(UUID jobId) {
        require(jobId);
        return store.findSegments(jobId);
    }

    /** Current audit entries, ordered by segment and then by stage. */
    public List<ChangeRecord> changes(UUID jobId) {
        require(jobId);
        return store.findChanges(jobId).stream()
                .sorted(Comparator.comparingInt(ChangeRecord::getSegmentIndex)
                        .thenComparing(ChangeRecord::getStage))
                .toList();
    }

    /**
     * The final document: per segment the enhanced text, else the polished
     * text, else the original, separated by blank lines.
     */
    public String exportText(UUID jobId) {
        Job job = require(jobId);
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new InvalidJobStateException(jobId, job.getStatus(),
                    "Job " + jobId + " is " + job.getStatus().wireName() + "; only completed jobs can be exported");
        }
        return store.findSegments(jobId).stream()
                .map(Segment::finalText)
                .collect(Collectors.joining("\n\n"));
    }

    /** Live events for {@code jobId} from now on; close the subscription to stop listening. */
    public Subscription subscribe(UUID jobId) {
        require(jobId);
        return events.subscribe(jobId);
    }

    public AdmissionStatus queueStatus(UUID jobId) {
        return jobId == null ? admission.status() : admission.status(jobId);
    }

    public void updateConcurrencyLimit(int limit) {
        admission.updateLimit(limit);
    }

    // ------------------------------------------------------------------
    // Control
    // ------------------------------------------------------------------

    /**
     * Re-queue a failed or stopped job. The new run reuses the existing
     * segments and resumes at the recorded failed segment.
     */
    public synchronized JobStatusSnapshot retry(UUID jobId) {
        Job job = require(jobId);
        if (!job.getStatus().isRetryable()) {
            throw new InvalidJobStateException(jobId, job.getStatus(),
                    "Job " + jobId + " is " + job.getStatus().wireName() + "; only failed or stopped jobs can be retried");
        }
        if (supervisor.isRunning(jobId)) {
            throw new InvalidJobStateException(jobId, job.getStatus(),
                    "The previous run of job " + jobId + " has not finished yet");
        }

        String previous = job.getErrorMessage();
        job.setStatus(JobStatus.QUEUED);
        job.setErrorMessage(previous == null ? null : RETRY_NOTE + previous);
        job.setCompletedAt(null);
        store.saveJob(job);
        events.publish(jobId, PipelineEvent.of(EventType.JOB_QUEUED, jobId, "Job re-queued for retry"));
        supervisor.launch(jobId);
        log.info("Job {} retrying from segment {}", jobId, job.getFailedSegmentIndex());
        return JobStatusSnapshot.of(job, admission.status(jobId));
    }

    /**
     * Stop a queued or processing job. A live run stops at its next segment
     * boundary (or immediately, if still waiting for admission) and records
     * the stop itself; otherwise the job is marked stopped here.
     *
     * @throws InvalidJobStateException if the job is not stoppable, including
     *         when its last run reached a terminal status in the meantime
     */
    public synchronized JobStatusSnapshot stop(UUID jobId) {
        Job job = require(jobId);
        if (!job.getStatus().isStoppable()) {
            throw notStoppable(jobId, job.getStatus());
        }

        if (supervisor.requestStop(jobId)) {
            log.info("Job {} asked to stop", jobId);
            return JobStatusSnapshot.of(job, admission.status(jobId));
        }

        // The snapshot above may predate the final write of a run that just finished.
        Job stopped = store.stopIfStoppable(jobId, JobStoppedException.MESSAGE)
                .orElseThrow(() -> notStoppable(jobId, require(jobId).getStatus()));
        events.publish(jobId, PipelineEvent.of(EventType.JOB_STOPPED, jobId, JobStoppedException.MESSAGE));
        log.info("Job {} had no live run; marked stopped", jobId);
        return JobStatusSnapshot.of(stopped, admission.status(jobId));
    }

    private static InvalidJobStateException notStoppable(UUID jobId, JobStatus status) {
        return new InvalidJobStateException(jobId, status,
                "Job " + jobId + " is " + status.wireName() + "; only queued or processing jobs can be stopped");
    }

    private Job require(UUID jobId) {
        return store.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }
}
