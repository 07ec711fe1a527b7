package com.draftsmith.orchestrator.pipeline;

import com.draftsmith.orchestrator.admission.AdmissionController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Launches pipeline runs on the worker pool and keeps track of them.
 *
 * At most one run per job is live at a time. The latest outcome per job is
 * kept for the most recently finished jobs only; older entries are evicted
 * once {@link #DEFAULT_OUTCOME_RETENTION} jobs have finished since.
 */
@Component
public class PipelineSupervisor {

    private static final Logger log = LoggerFactory.getLogger(PipelineSupervisor.class);

    static final int DEFAULT_OUTCOME_RETENTION = 1024;

    private final PipelineRunner      runner;
    private final AdmissionController admission;
    private final ExecutorService     workers;

    private final Map<UUID, RunHandle>  active = new ConcurrentHashMap<>();
    private final Map<UUID, RunOutcome> outcomes;

    @Autowired
    public PipelineSupervisor(PipelineRunner runner,
                              AdmissionController admission,
                              @Qualifier("pipelineWorkers") ExecutorService workers) {
        this(runner, admission, workers, DEFAULT_OUTCOME_RETENTION);
    }

    PipelineSupervisor(PipelineRunner runner,
                       AdmissionController admission,
                       ExecutorService workers,
                       int outcomeRetention) {
        if (outcomeRetention < 1) {
            throw new IllegalArgumentException("outcomeRetention must be positive, got " + outcomeRetention);
        }
        this.runner    = runner;
        this.admission = admission;
        this.workers   = workers;
        this.outcomes  = Collections.synchronizedMap(new LinkedHashMap<UUID, RunOutcome>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<UUID, RunOutcome> eldest) {
                return size() > outcomeRetention;
            }
        });
    }

    /**
     * Start a run for {@code jobId}.
     *
     * @throws IllegalStateException if a run for this job is still live
     */
    public synchronized RunHandle launch(UUID jobId) {
        RunHandle current = active.get(jobId);
        if (current != null && !current.isDone()) {
            throw new IllegalStateException("A run for job " + jobId + " is already in progress");
        }

        CancellationToken token = new CancellationToken();
        CompletableFuture<RunOutcome> future = CompletableFuture.supplyAsync(() -> runner.run(jobId, token), workers);
        RunHandle handle = new RunHandle(jobId, token, future, Instant.now());
        active.put(jobId, handle);
        future.whenComplete((outcome, error) -> onFinished(handle, outcome, error));
        log.info("Launched pipeline run for job {}", jobId);
        return handle;
    }

    /**
     * Ask the live run of {@code jobId} to stop at its next segment boundary.
     * A run still waiting for admission is withdrawn from the queue at once.
     *
     * @return false if no run is live for this job
     */
    public boolean requestStop(UUID jobId) {
        RunHandle handle = active.get(jobId);
        if (handle == null || handle.isDone()) {
            return false;
        }
        handle.token().cancel();
        admission.withdraw(jobId);
        log.info("Stop requested for job {}", jobId);
        return true;
    }

    public boolean isRunning(UUID jobId) {
        RunHandle handle = active.get(jobId);
        return handle != null && !handle.isDone();
    }

    public Optional<RunHandle> handle(UUID jobId) {
        return Optional.ofNullable(active.get(jobId));
    }

    /** Outcome of the most recently finished run of {@code jobId}, while it is still retained. */
    public Optional<RunOutcome> lastOutcome(UUID jobId) {
        return Optional.ofNullable(outcomes.get(jobId));
    }

    private void onFinished(RunHandle handle, RunOutcome outcome, Throwable error) {
        UUID jobId = handle.jobId();
        if (error != null) {
            // PipelineRunner.run() handles its own failures; reaching here means the worker itself broke.
            log.error("Pipeline run for job {} terminated abnormally", jobId, error);
            outcome = RunOutcome.failed(jobId, String.valueOf(error.getMessage()), null);
        }
        synchronized (outcomes) {
            // re-insert so a job that ran again counts as the newest entry
            outcomes.remove(jobId);
            outcomes.put(jobId, outcome);
        }
        active.remove(jobId, handle);
        log.info("Pipeline run for job {} finished: {}", jobId, outcome.status());
    }
}
