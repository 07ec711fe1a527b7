package com.draftsmith.orchestrator.pipeline;

import com.draftsmith.orchestrator.admission.AdmissionController;
import com.draftsmith.orchestrator.config.LlmProperties;
import com.draftsmith.orchestrator.config.PipelineProperties;
import com.draftsmith.orchestrator.llm.ChatMessage;
import com.draftsmith.orchestrator.llm.ChatModelClient;
import com.draftsmith.orchestrator.llm.ChatRequest;
import com.draftsmith.orchestrator.llm.StageCallFailedException;
import com.draftsmith.orchestrator.llm.UnconfiguredChatModelClient;
import com.draftsmith.orchestrator.model.ChangeRecord;
import com.draftsmith.orchestrator.model.Job;
import com.draftsmith.orchestrator.model.JobStatus;
import com.draftsmith.orchestrator.model.ProcessingMode;
import com.draftsmith.orchestrator.model.Segment;
import com.draftsmith.orchestrator.model.SegmentStatus;
import com.draftsmith.orchestrator.model.Stage;
import com.draftsmith.orchestrator.stream.EventBroadcaster;
import com.draftsmith.orchestrator.stream.EventType;
import com.draftsmith.orchestrator.stream.PipelineEvent;
import com.draftsmith.orchestrator.stream.Subscription;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for PipelineRunner.
 *
 * Runs are executed synchronously on the test thread against an in-memory
 * store and a scripted model client; no Spring context, no database.
 */
class PipelineRunnerTest {

    private static final String THREE_PARAGRAPHS = """
            Alpha paragraph opens the draft here.
            Bravo paragraph continues the argument.
            Charlie paragraph closes the section.""";

    private InMemoryPipelineStore store;
    private AdmissionController   admission;
    private EventBroadcaster      events;
    private PipelineProperties    properties;
    private ModelEndpointResolver endpoints;
    private SimpleMeterRegistry   meterRegistry;
    private final StagePrompts    prompts = new StagePrompts();

    @BeforeEach
    void setUp() {
        store         = new InMemoryPipelineStore();
        admission     = new AdmissionController(5, Duration.ofSeconds(300));
        events        = new EventBroadcaster(1024);
        properties    = new PipelineProperties();
        meterRegistry = new SimpleMeterRegistry();

        LlmProperties llm = new LlmProperties();
        llm.setApiKey("sk-test-key-0000000000");
        llm.getStages().getPolish().setModel("polish-model");
        llm.getStages().getEnhance().setModel("enhance-model");
        llm.getStages().getCompression().setModel("compression-model");
        endpoints = new ModelEndpointResolver(llm);
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void run_polishAndEnhance_completesWithBothOutputs() {
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> "[done] " + text);
        Job job = saveJob(THREE_PARAGRAPHS, ProcessingMode.PAPER_POLISH_ENHANCE);

        RunOutcome outcome = runnerWith(client).run(job.getId(), new CancellationToken());

        assertThat(outcome.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(100.0);
        assertThat(job.getTotalSegments()).isEqualTo(3);
        assertThat(job.getCurrentPosition()).isEqualTo(3);
        assertThat(job.getCompletedAt()).isNotNull();
        assertThat(job.getErrorMessage()).isNull();

        Segment first = store.findSegments(job.getId()).get(0);
        assertThat(first.getPolishedText()).isEqualTo("[done] Alpha paragraph opens the draft here.");
        // The enhancing stage works on the polished text.
        assertThat(first.getEnhancedText()).isEqualTo("[done] [done] Alpha paragraph opens the draft here.");
        assertThat(first.getStatus()).isEqualTo(SegmentStatus.COMPLETED);
        assertThat(client.transformCalls()).hasSize(6);
        assertThat(admission.activeCount()).isZero();
    }

    @Test
    void run_transformationCall_usesStageModelAndTemperature() {
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> text);
        Job job = saveJob("Alpha paragraph opens the draft here.", ProcessingMode.PAPER_POLISH_ENHANCE);

        runnerWith(client).run(job.getId(), new CancellationToken());

        ChatRequest polish  = client.transformCalls().get(0);
        ChatRequest enhance = client.transformCalls().get(1);
        assertThat(polish.endpoint().model()).isEqualTo("polish-model");
        assertThat(enhance.endpoint().model()).isEqualTo("enhance-model");
        assertThat(polish.temperature()).isEqualTo(PipelineRunner.TEMPERATURE);
        assertThat(polish.messages()).hasSize(2);
        assertThat(polish.messages().get(0).content()).isEqualTo(prompts.forStage(Stage.POLISH));
        assertThat(polish.messages().get(1).content()).isEqualTo("\n\nAlpha paragraph opens the draft here.");
    }

    @Test
    void run_earlierOutputs_areSentAsHistory() {
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> "out:" + text.substring(0, 5));
        Job job = saveJob(THREE_PARAGRAPHS, ProcessingMode.PAPER_POLISH);

        runnerWith(client).run(job.getId(), new CancellationToken());

        List<ChatMessage> thirdHistory = ScriptedChatModelClient.historyOf(client.transformCalls().get(2));
        assertThat(thirdHistory).extracting(ChatMessage::content).containsExactly("out:Alpha", "out:Bravo");
        assertThat(thirdHistory).allMatch(ChatMessage::isAssistant);
    }

    @Test
    void run_recordsChangeAuditPerSegmentAndStage() {
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> text + " Indeed.");
        Job job = saveJob(THREE_PARAGRAPHS, ProcessingMode.PAPER_POLISH);

        runnerWith(client).run(job.getId(), new CancellationToken());

        List<ChangeRecord> changes = store.findChanges(job.getId());
        assertThat(changes).hasSize(3);
        ChangeRecord first = changes.get(0);
        assertThat(first.getStage()).isEqualTo(Stage.POLISH);
        assertThat(first.getBeforeText()).isEqualTo("Alpha paragraph opens the draft here.");
        assertThat(first.getAfterText()).isEqualTo("Alpha paragraph opens the draft here. Indeed.");
        assertThat(first.getChangesDetail()).contains("\"changed\":true");
    }

    @Test
    void run_publishesLifecycleAndMonotonicProgress() throws Exception {
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> text);
        Job job = saveJob("Alpha paragraph opens the draft here.\nBravo paragraph continues the argument.",
                ProcessingMode.PAPER_POLISH_ENHANCE);
        Subscription subscription = events.subscribe(job.getId());

        runnerWith(client).run(job.getId(), new CancellationToken());

        List<PipelineEvent> received = drain(subscription);
        assertThat(received.get(0).type()).isEqualTo(EventType.JOB_STARTED);
        assertThat(received.get(received.size() - 1).type()).isEqualTo(EventType.JOB_COMPLETED);
        assertThat(received).filteredOn(e -> e.type() == EventType.STAGE_STARTED)
                .extracting(PipelineEvent::stage).containsExactly("polish", "enhance");
        assertThat(received).filteredOn(e -> e.type() == EventType.PROGRESS)
                .extracting(PipelineEvent::progress).containsExactly(0.0, 25.0, 50.0, 75.0);
        assertThat(received).filteredOn(e -> e.type() == EventType.SEGMENT_COMPLETED).hasSize(4);
    }

    // ------------------------------------------------------------------
    // Pass-through segments
    // ------------------------------------------------------------------

    @Test
    void run_shortSegment_passesThroughWithoutModelCall() {
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> "P:" + text);
        Job job = saveJob("Introduction\nThis paragraph is long enough to be transformed.",
                ProcessingMode.PAPER_POLISH_ENHANCE);

        RunOutcome outcome = runnerWith(client).run(job.getId(), new CancellationToken());

        assertThat(outcome.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(client.transformedInputs()).containsExactly(
                "This paragraph is long enough to be transformed.",
                "P:This paragraph is long enough to be transformed.");

        Segment heading = store.findSegments(job.getId()).get(0);
        assertThat(heading.isTrivial()).isTrue();
        assertThat(heading.getStatus()).isEqualTo(SegmentStatus.COMPLETED);
        assertThat(heading.getPolishedText()).isEqualTo("Introduction");
        assertThat(heading.getEnhancedText()).isEqualTo("Introduction");
    }

    @Test
    void run_passThroughOutputs_areNotAddedToHistory() {
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> "P:" + text);
        Job job = saveJob("Heading\nThis paragraph is long enough to be transformed.\nAnother paragraph long enough too.",
                ProcessingMode.PAPER_POLISH);

        runnerWith(client).run(job.getId(), new CancellationToken());

        assertThat(ScriptedChatModelClient.historyOf(client.transformCalls().get(1)))
                .extracting(ChatMessage::content)
                .containsExactly("P:This paragraph is long enough to be transformed.");
    }

    // ------------------------------------------------------------------
    // Failure and retry
    // ------------------------------------------------------------------

    @Test
    void run_segmentFails_thenRetryResumesAtFailedSegment() {
        AtomicBoolean failBravo = new AtomicBoolean(true);
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> {
            if (text.startsWith("Bravo") && failBravo.get()) {
                throw StageCallFailedException.transport("connection reset", null);
            }
            return "polished " + text;
        });
        Job job = saveJob(THREE_PARAGRAPHS, ProcessingMode.PAPER_POLISH);
        PipelineRunner runner = runnerWith(client);

        RunOutcome failed = runner.run(job.getId(), new CancellationToken());

        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.failedSegmentIndex()).isEqualTo(1);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getFailedSegmentIndex()).isEqualTo(1);
        assertThat(job.getErrorMessage())
                .startsWith("Segment 2 failed during polish stage")
                .contains("connection reset");
        assertThat(store.findSegments(job.getId())).extracting(Segment::getStatus)
                .containsExactly(SegmentStatus.COMPLETED, SegmentStatus.FAILED, SegmentStatus.PENDING);
        assertThat(admission.activeCount()).isZero();

        // Retry: only the failed segment and the ones after it reach the model.
        failBravo.set(false);
        client.reset();
        job.setStatus(JobStatus.QUEUED);

        RunOutcome retried = runner.run(job.getId(), new CancellationToken());

        assertThat(retried.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(client.transformedInputs()).containsExactly(
                "Bravo paragraph continues the argument.",
                "Charlie paragraph closes the section.");
        assertThat(ScriptedChatModelClient.historyOf(client.transformCalls().get(0)))
                .extracting(ChatMessage::content)
                .containsExactly("polished Alpha paragraph opens the draft here.");
        assertThat(store.findSegments(job.getId())).extracting(Segment::getStatus)
                .containsOnly(SegmentStatus.COMPLETED);
        assertThat(job.getFailedSegmentIndex()).isNull();
        assertThat(job.getErrorMessage()).isNull();
        assertThat(job.getProgress()).isEqualTo(100.0);
    }

    @Test
    void run_retryOfTwoStageJob_neverReprocessesExistingOutputs() {
        AtomicBoolean failEnhance = new AtomicBoolean(true);
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> {
            if (text.startsWith("P:Bravo") && failEnhance.get()) {
                throw StageCallFailedException.httpStatus(503, "overloaded");
            }
            return "P:" + text;
        });
        Job job = saveJob(THREE_PARAGRAPHS, ProcessingMode.PAPER_POLISH_ENHANCE);
        PipelineRunner runner = runnerWith(client);

        runner.run(job.getId(), new CancellationToken());
        assertThat(job.getCurrentStage()).isEqualTo(Stage.ENHANCE);
        assertThat(job.getFailedSegmentIndex()).isEqualTo(1);

        failEnhance.set(false);
        client.reset();
        job.setStatus(JobStatus.QUEUED);
        runner.run(job.getId(), new CancellationToken());

        // Polish outputs all exist, so the polish stage is a walk-through.
        assertThat(client.transformedInputs()).containsExactly(
                "P:Bravo paragraph continues the argument.",
                "P:Charlie paragraph closes the section.");
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void run_missingContent_failsSegment() {
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> null);
        Job job = saveJob(THREE_PARAGRAPHS, ProcessingMode.PAPER_POLISH);

        RunOutcome outcome = runnerWith(client).run(job.getId(), new CancellationToken());

        assertThat(outcome.status()).isEqualTo(JobStatus.FAILED);
        assertThat(outcome.failedSegmentIndex()).isZero();
        assertThat(job.getErrorMessage()).contains("missing the 'content' field");
        assertThat(meterRegistry.counter("draftsmith.segment.calls",
                "stage", "polish", "status", "missing_content").count()).isEqualTo(1.0);
    }

    @Test
    void run_noClientConfigured_failsFirstSegment() {
        Job job = saveJob(THREE_PARAGRAPHS, ProcessingMode.PAPER_POLISH);

        RunOutcome outcome = runnerWith(new UnconfiguredChatModelClient()).run(job.getId(), new CancellationToken());

        assertThat(outcome.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage())
                .isEqualTo("Segment 1 failed during polish stage: No language-model client is configured");
        assertThat(job.getFailedSegmentIndex()).isZero();
    }

    @Test
    void run_longErrorMessage_isTruncated() {
        String huge = "x".repeat(800);
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> {
            throw new IllegalStateException(huge);
        });
        Job job = saveJob(THREE_PARAGRAPHS, ProcessingMode.PAPER_POLISH);

        runnerWith(client).run(job.getId(), new CancellationToken());

        assertThat(job.getErrorMessage()).hasSize(503).endsWith("...");
    }

    @Test
    void run_missingJob_reportsFailureWithoutThrowing() {
        RunOutcome outcome = runnerWith(new ScriptedChatModelClient(text -> text))
                .run(UUID.randomUUID(), new CancellationToken());

        assertThat(outcome.status()).isEqualTo(JobStatus.FAILED);
        assertThat(outcome.error()).startsWith("Job not found");
    }

    // ------------------------------------------------------------------
    // History compression
    // ------------------------------------------------------------------

    @Test
    void run_historyOverThreshold_nextCallSeesSingleSummary() throws Exception {
        properties.setHistoryCompressionThreshold(20);
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> {
            if (text.startsWith("Alpha")) return letters(12);
            if (text.startsWith("Bravo")) return letters(15);
            return "final";
        }, request -> "condensed");
        Job job = saveJob(THREE_PARAGRAPHS, ProcessingMode.PAPER_POLISH);
        Subscription subscription = events.subscribe(job.getId());

        runnerWith(client).run(job.getId(), new CancellationToken());

        // 12 + 15 > 20, so the history was compressed before the third call.
        ChatRequest firstCompression = client.compressionCalls().get(0);
        assertThat(firstCompression.endpoint().model()).isEqualTo("compression-model");
        assertThat(firstCompression.messages().get(1).content())
                .contains(letters(12)).contains(letters(15));

        List<ChatMessage> thirdHistory = ScriptedChatModelClient.historyOf(client.transformCalls().get(2));
        assertThat(thirdHistory).hasSize(1);
        assertThat(thirdHistory.get(0).isSystem()).isTrue();
        assertThat(thirdHistory.get(0).content()).isEqualTo(StagePrompts.SUMMARY_PREFIX + "condensed");

        assertThat(store.findCompressedHistory(job.getId(), Stage.POLISH)).isPresent();
        assertThat(meterRegistry.counter("draftsmith.history.compressions", "stage", "polish").count())
                .isEqualTo((double) client.compressionCalls().size());
        assertThat(drain(subscription)).anyMatch(e -> e.type() == EventType.HISTORY_COMPRESSED);
    }

    @Test
    void run_retryAfterCompression_seedsHistoryFromPersistedSummary() {
        properties.setHistoryCompressionThreshold(60);
        AtomicBoolean failDelta = new AtomicBoolean(true);
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> {
            if (text.startsWith("Alpha"))   return letters(30);
            if (text.startsWith("Bravo"))   return letters(35);
            if (text.startsWith("Charlie")) return letters(10);
            if (failDelta.get()) throw StageCallFailedException.transport("timeout", null);
            return "done";
        }, request -> "s");
        Job job = saveJob(THREE_PARAGRAPHS + "\nDelta paragraph wraps everything up.", ProcessingMode.PAPER_POLISH);
        PipelineRunner runner = runnerWith(client);

        runner.run(job.getId(), new CancellationToken());
        assertThat(job.getFailedSegmentIndex()).isEqualTo(3);
        assertThat(store.findCompressedHistory(job.getId(), Stage.POLISH))
                .hasValueSatisfying(h -> assertThat(h.getCoveredThrough()).isEqualTo(1));

        failDelta.set(false);
        client.reset();
        job.setStatus(JobStatus.QUEUED);
        runner.run(job.getId(), new CancellationToken());

        assertThat(client.transformedInputs()).containsExactly("Delta paragraph wraps everything up.");
        assertThat(ScriptedChatModelClient.historyOf(client.transformCalls().get(0)))
                .extracting(ChatMessage::content)
                .containsExactly(StagePrompts.SUMMARY_PREFIX + "s", letters(10));
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void run_compressionFails_segmentFailsAndRetryContinuesAfterIt() {
        properties.setHistoryCompressionThreshold(20);
        AtomicBoolean compressionDown = new AtomicBoolean(true);
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> {
            if (text.startsWith("Alpha")) return letters(12);
            if (text.startsWith("Bravo")) return letters(15);
            return "final";
        }, request -> {
            if (compressionDown.get()) throw StageCallFailedException.httpStatus(500, "boom");
            return "condensed";
        });
        Job job = saveJob(THREE_PARAGRAPHS, ProcessingMode.PAPER_POLISH);
        PipelineRunner runner = runnerWith(client);

        runner.run(job.getId(), new CancellationToken());

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getFailedSegmentIndex()).isEqualTo(1);
        Segment bravo = store.findSegments(job.getId()).get(1);
        assertThat(bravo.getStatus()).isEqualTo(SegmentStatus.FAILED);
        assertThat(bravo.getPolishedText()).isEqualTo(letters(15));

        compressionDown.set(false);
        client.reset();
        job.setStatus(JobStatus.QUEUED);
        runner.run(job.getId(), new CancellationToken());

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(client.transformedInputs()).containsExactly("Charlie paragraph closes the section.");
        assertThat(bravo.getStatus()).isEqualTo(SegmentStatus.COMPLETED);
        assertThat(ScriptedChatModelClient.historyOf(client.transformCalls().get(0)))
                .extracting(ChatMessage::content)
                .containsExactly(letters(12), letters(15));
    }

    // ------------------------------------------------------------------
    // Stop
    // ------------------------------------------------------------------

    @Test
    void run_cancelledBeforeAdmission_stopsWithoutModelCalls() {
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> text);
        Job job = saveJob(THREE_PARAGRAPHS, ProcessingMode.PAPER_POLISH);
        CancellationToken token = new CancellationToken();
        token.cancel();

        RunOutcome outcome = runnerWith(client).run(job.getId(), token);

        assertThat(outcome.status()).isEqualTo(JobStatus.STOPPED);
        assertThat(job.getStatus()).isEqualTo(JobStatus.STOPPED);
        assertThat(job.getErrorMessage()).isEqualTo(JobStoppedException.MESSAGE);
        assertThat(client.transformCalls()).isEmpty();
        assertThat(admission.activeCount()).isZero();
    }

    @Test
    void run_cancelledMidRun_stopsAtNextSegmentBoundary() {
        CancellationToken token = new CancellationToken();
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> {
            token.cancel();
            return "polished " + text;
        });
        Job job = saveJob(THREE_PARAGRAPHS, ProcessingMode.PAPER_POLISH);

        RunOutcome outcome = runnerWith(client).run(job.getId(), token);

        assertThat(outcome.status()).isEqualTo(JobStatus.STOPPED);
        assertThat(client.transformCalls()).hasSize(1);
        assertThat(store.findSegments(job.getId())).extracting(Segment::getStatus)
                .containsExactly(SegmentStatus.COMPLETED, SegmentStatus.PENDING, SegmentStatus.PENDING);
        assertThat(admission.activeCount()).isZero();
    }

    @Test
    void run_stopCannotBePersisted_stillReportsStopWithoutThrowing() throws Exception {
        store = new InMemoryPipelineStore() {
            @Override
            public Job saveJob(Job job) {
                if (job.getStatus() == JobStatus.STOPPED) {
                    throw new IllegalStateException("database unavailable");
                }
                return super.saveJob(job);
            }
        };
        ScriptedChatModelClient client = new ScriptedChatModelClient(text -> text);
        Job job = saveJob(THREE_PARAGRAPHS, ProcessingMode.PAPER_POLISH);
        Subscription subscription = events.subscribe(job.getId());
        CancellationToken token = new CancellationToken();
        token.cancel();

        RunOutcome outcome = runnerWith(client).run(job.getId(), token);

        assertThat(outcome.status()).isEqualTo(JobStatus.STOPPED);
        assertThat(drain(subscription)).anyMatch(e -> e.type() == EventType.JOB_STOPPED);
        assertThat(admission.activeCount()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PipelineRunner runnerWith(ChatModelClient client) {
        return new PipelineRunner(store, admission, events, client,
                new HistoryCompressor(client, prompts), prompts, endpoints,
                properties, meterRegistry, new ObjectMapper());
    }

    private Job saveJob(String text, ProcessingMode mode) {
        return store.saveJob(new Job(text, mode));
    }

    private static String letters(int n) {
        return "x".repeat(n);
    }

    private static List<PipelineEvent> drain(Subscription subscription) throws InterruptedException {
        List<PipelineEvent> received = new ArrayList<>();
        Optional<PipelineEvent> next;
        while ((next = subscription.poll(Duration.ZERO)).isPresent()) {
            received.add(next.get());
        }
        return received;
    }
}
