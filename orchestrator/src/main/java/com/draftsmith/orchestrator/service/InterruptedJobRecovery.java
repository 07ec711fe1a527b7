package com.draftsmith.orchestrator.service;

import com.draftsmith.orchestrator.model.Job;
import com.draftsmith.orchestrator.model.JobStatus;
import com.draftsmith.orchestrator.repository.PipelineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Cleans up jobs whose run died with the previous process.
 *
 * Runs live only in memory, so at startup any job still QUEUED or PROCESSING
 * has no run behind it. Such jobs are marked FAILED, keeping their failed
 * segment index, so a retry resumes them where they stopped.
 */
@Component
public class InterruptedJobRecovery {

    private static final Logger log = LoggerFactory.getLogger(InterruptedJobRecovery.class);

    static final String INTERRUPTED_MESSAGE = "Interrupted by service restart";

    private final PipelineStore store;

    public InterruptedJobRecovery(PipelineStore store) {
        this.store = store;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        recover();
    }

    /** @return number of jobs marked failed */
    public int recover() {
        List<Job> orphaned = new ArrayList<>(store.findJobsByStatus(JobStatus.PROCESSING));
        orphaned.addAll(store.findJobsByStatus(JobStatus.QUEUED));
        for (Job job : orphaned) {
            log.warn("Job {} was {} when the service stopped; marking failed so it can be retried",
                    job.getId(), job.getStatus());
            job.setStatus(JobStatus.FAILED);
            job.setErrorMessage(INTERRUPTED_MESSAGE);
            store.saveJob(job);
        }
        return orphaned.size();
    }
}
