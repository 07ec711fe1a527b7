package com.draftsmith.orchestrator.api;

import com.draftsmith.orchestrator.admission.AdmissionStatus;
import com.draftsmith.orchestrator.api.dto.ChangeResponse;
import com.draftsmith.orchestrator.api.dto.JobResponse;
import com.draftsmith.orchestrator.api.dto.SegmentResponse;
import com.draftsmith.orchestrator.api.dto.SubmitJobRequest;
import com.draftsmith.orchestrator.model.ChangeRecord;
import com.draftsmith.orchestrator.model.Job;
import com.draftsmith.orchestrator.service.JobService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for the job lifecycle.
 *
 * POST /jobs                 submit a document for processing
 * GET  /jobs/queue           admission queue status (optionally for one job)
 * GET  /jobs/{id}            poll the current status of a job
 * GET  /jobs/{id}/segments   per-segment texts and status
 * GET  /jobs/{id}/changes    before/after audit trail
 * GET  /jobs/{id}/export     final text of a completed job
 * GET  /jobs/{id}/events     live progress as server-sent events
 * POST /jobs/{id}/retry      resume a failed or stopped job
 * POST /jobs/{id}/stop       stop a queued or processing job
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private final JobService    jobService;
    private final EventStreamer eventStreamer;
    private final ObjectMapper  objectMapper;

    public JobController(JobService jobService, EventStreamer eventStreamer, ObjectMapper objectMapper) {
        this.jobService    = jobService;
        this.eventStreamer = eventStreamer;
        this.objectMapper  = objectMapper;
    }

    /**
     * Submit a new job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"text":"First paragraph.\nSecond paragraph.","mode":"paper_polish"}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> submit(@RequestBody SubmitJobRequest req) {
        Job job = jobService.submit(req.text(), req.mode(), req.overrides());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    @GetMapping("/queue")
    public AdmissionStatus queue(@RequestParam(required = false) UUID jobId) {
        return jobService.queueStatus(jobId);
    }

    /** Returns 404 if the job ID is not found. */
    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        return JobResponse.from(jobService.getStatus(id));
    }

    @GetMapping("/{id}/segments")
    public List<SegmentResponse> getSegments(@PathVariable UUID id) {
        return jobService.segments(id).stream()
                .map(SegmentResponse::from)
                .toList();
    }

    @GetMapping("/{id}/changes")
    public List<ChangeResponse> getChanges(@PathVariable UUID id) {
        return jobService.changes(id).stream()
                .map(c -> ChangeResponse.from(c, parseDetail(c)))
                .toList();
    }

    /** HTTP 409 unless the job has completed. */
    @GetMapping(value = "/{id}/export", produces = MediaType.TEXT_PLAIN_VALUE)
    public String export(@PathVariable UUID id) {
        return jobService.exportText(id);
    }

    /**
     * Live events for the job. Only events published after the connection
     * opens are delivered; poll GET /jobs/{id} for the current state first.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable UUID id) {
        return eventStreamer.stream(id);
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<JobResponse> retry(@PathVariable UUID id) {
        return ResponseEntity.accepted().body(JobResponse.from(jobService.retry(id)));
    }

    @PostMapping("/{id}/stop")
    public ResponseEntity<JobResponse> stop(@PathVariable UUID id) {
        return ResponseEntity.accepted().body(JobResponse.from(jobService.stop(id)));
    }

    private Map<String, Object> parseDetail(ChangeRecord change) {
        if (change.getChangesDetail() == null) return null;
        try {
            return objectMapper.readValue(change.getChangesDetail(), new TypeReference<>() {});
        } catch (Exception e) {
            log.warn("Unreadable change detail for job {} segment {}: {}",
                    change.getJobId(), change.getSegmentIndex(), e.getMessage());
            return null;
        }
    }
}
