package com.draftsmith.orchestrator.api;

import com.draftsmith.orchestrator.admission.AdmissionStatus;
import com.draftsmith.orchestrator.model.*;
import com.draftsmith.orchestrator.service.InvalidJobStateException;
import com.draftsmith.orchestrator.service.JobNotFoundException;
import com.draftsmith.orchestrator.service.JobService;
import com.draftsmith.orchestrator.service.JobStatusSnapshot;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for JobController.
 *
 * @WebMvcTest spins up only the web layer (no DB, no workers, no model calls).
 * JobService and EventStreamer are replaced by mocks.
 */
@WebMvcTest(JobController.class)
class JobControllerTest {

    @Autowired MockMvc         mockMvc;
    @MockitoBean JobService    jobService;
    @MockitoBean EventStreamer eventStreamer;

    // ------------------------------------------------------------------
    // POST /jobs
    // ------------------------------------------------------------------

    @Test
    void submitJob_validRequest_returns201WithJobId() throws Exception {
        Job job = new Job("First paragraph.", ProcessingMode.PAPER_POLISH);
        when(jobService.submit(eq("First paragraph."), eq("paper_polish"), any())).thenReturn(job);

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"First paragraph.","mode":"paper_polish"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(job.getId().toString()))
                .andExpect(jsonPath("$.status").value("queued"))
                .andExpect(jsonPath("$.mode").value("paper_polish"))
                .andExpect(jsonPath("$.currentStage").value("polish"));
    }

    @Test
    void submitJob_modeOmitted_defaultsToPolishAndEnhance() throws Exception {
        Job job = new Job("Text.", ProcessingMode.PAPER_POLISH_ENHANCE);
        when(jobService.submit(eq("Text."), eq("paper_polish_enhance"), any())).thenReturn(job);

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"Text."}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.mode").value("paper_polish_enhance"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void submitJob_stageConfigs_passedAsOverrides() throws Exception {
        Job job = new Job("Text.", ProcessingMode.PAPER_POLISH_ENHANCE);
        when(jobService.submit(any(), any(), any())).thenReturn(job);

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"Text.","polishConfig":{"model":"custom-model","apiKey":""}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.polishConfig").doesNotExist());

        ArgumentCaptor<Map<Stage, ModelOverride>> captor = ArgumentCaptor.forClass(Map.class);
        verify(jobService).submit(eq("Text."), eq("paper_polish_enhance"), captor.capture());
        ModelOverride polish = captor.getValue().get(Stage.POLISH);
        assertThat(polish.getModel()).isEqualTo("custom-model");
        assertThat(polish.getApiKey()).isNull();
        assertThat(captor.getValue()).doesNotContainKey(Stage.ENHANCE);
    }

    @Test
    void submitJob_unknownMode_returns400() throws Exception {
        when(jobService.submit(any(), eq("haiku"), any())).thenThrow(new UnknownProcessingModeException("haiku"));

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"Text.","mode":"haiku"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown Processing Mode"))
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("haiku")))
                .andExpect(jsonPath("$.path").value("/jobs"));
    }

    @Test
    void submitJob_blankText_returns400() throws Exception {
        when(jobService.submit(any(), any(), any()))
                .thenThrow(new IllegalArgumentException("Text to process must not be blank"));

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"  "}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Error"));
    }

    @Test
    void submitJob_malformedJson_returns400() throws Exception {
        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed Request"));
    }

    // ------------------------------------------------------------------
    // GET /jobs/{id}
    // ------------------------------------------------------------------

    @Test
    void getJob_existingJob_returns200WithProgress() throws Exception {
        Job job = new Job("Text.", ProcessingMode.PAPER_POLISH_ENHANCE);
        job.setStatus(JobStatus.PROCESSING);
        job.setCurrentStage(Stage.ENHANCE);
        job.setTotalSegments(4);
        job.setCurrentPosition(2);
        job.setProgress(75.0);
        when(jobService.getStatus(job.getId())).thenReturn(JobStatusSnapshot.of(job, null));

        mockMvc.perform(get("/jobs/{id}", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("processing"))
                .andExpect(jsonPath("$.currentStage").value("enhance"))
                .andExpect(jsonPath("$.totalSegments").value(4))
                .andExpect(jsonPath("$.progress").value(75.0));
    }

    @Test
    void getJob_unknownJob_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(jobService.getStatus(id)).thenThrow(new JobNotFoundException(id));

        mockMvc.perform(get("/jobs/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Job not found: " + id));
    }

    @Test
    void getJob_invalidUuid_returns400() throws Exception {
        mockMvc.perform(get("/jobs/not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getQueue_returnsAdmissionStatus() throws Exception {
        UUID id = UUID.randomUUID();
        when(jobService.queueStatus(id)).thenReturn(new AdmissionStatus(5, 5, 2, 1, 300L));

        mockMvc.perform(get("/jobs/queue").param("jobId", id.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeJobs").value(5))
                .andExpect(jsonPath("$.queueLength").value(2))
                .andExpect(jsonPath("$.position").value(1))
                .andExpect(jsonPath("$.estimatedWaitSeconds").value(300));
    }

    // ------------------------------------------------------------------
    // Segments, changes and export
    // ------------------------------------------------------------------

    @Test
    void getSegments_returnsSegmentsInOrder() throws Exception {
        UUID jobId = UUID.randomUUID();
        Segment heading = new Segment(jobId, 0, Stage.POLISH, "Intro");
        heading.markPassThrough(Stage.POLISH);
        Segment body = new Segment(jobId, 1, Stage.POLISH, "Body text here.");
        when(jobService.segments(jobId)).thenReturn(List.of(heading, body));

        mockMvc.perform(get("/jobs/{id}/segments", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].index").value(0))
                .andExpect(jsonPath("$[0].passThrough").value(true))
                .andExpect(jsonPath("$[0].status").value("completed"))
                .andExpect(jsonPath("$[1].status").value("pending"));
    }

    @Test
    void getChanges_parsesStoredDetail() throws Exception {
        UUID jobId = UUID.randomUUID();
        ChangeRecord change = new ChangeRecord(jobId, 0, Stage.POLISH);
        change.update("before", "after", "{\"beforeLength\":6,\"afterLength\":5,\"changed\":true}");
        when(jobService.changes(jobId)).thenReturn(List.of(change));

        mockMvc.perform(get("/jobs/{id}/changes", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].stage").value("polish"))
                .andExpect(jsonPath("$[0].afterText").value("after"))
                .andExpect(jsonPath("$[0].detail.changed").value(true));
    }

    @Test
    void export_completedJob_returnsPlainText() throws Exception {
        UUID id = UUID.randomUUID();
        when(jobService.exportText(id)).thenReturn("One.\n\nTwo.");

        mockMvc.perform(get("/jobs/{id}/export", id))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string("One.\n\nTwo."));
    }

    @Test
    void export_unfinishedJob_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(jobService.exportText(id)).thenThrow(
                new InvalidJobStateException(id, JobStatus.PROCESSING, "only completed jobs can be exported"));

        mockMvc.perform(get("/jobs/{id}/export", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Invalid Job State"));
    }

    // ------------------------------------------------------------------
    // POST /jobs/{id}/retry and /stop
    // ------------------------------------------------------------------

    @Test
    void retry_failedJob_returns202Queued() throws Exception {
        Job job = new Job("Text.", ProcessingMode.PAPER_POLISH);
        job.setFailedSegmentIndex(3);
        when(jobService.retry(job.getId())).thenReturn(JobStatusSnapshot.of(job, null));

        mockMvc.perform(post("/jobs/{id}/retry", job.getId()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("queued"))
                .andExpect(jsonPath("$.failedSegmentIndex").value(3));
    }

    @Test
    void retry_completedJob_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(jobService.retry(id)).thenThrow(
                new InvalidJobStateException(id, JobStatus.COMPLETED, "only failed or stopped jobs can be retried"));

        mockMvc.perform(post("/jobs/{id}/retry", id))
                .andExpect(status().isConflict());
    }

    @Test
    void stop_queuedJob_returns202() throws Exception {
        Job job = new Job("Text.", ProcessingMode.PAPER_POLISH);
        job.setStatus(JobStatus.STOPPED);
        when(jobService.stop(job.getId())).thenReturn(JobStatusSnapshot.of(job, null));

        mockMvc.perform(post("/jobs/{id}/stop", job.getId()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("stopped"));
    }

    @Test
    void stop_unexpectedFailure_returns500WithoutDetails() throws Exception {
        UUID id = UUID.randomUUID();
        when(jobService.stop(id)).thenThrow(new IllegalStateException("db exploded"));

        mockMvc.perform(post("/jobs/{id}/stop", id))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }
}
