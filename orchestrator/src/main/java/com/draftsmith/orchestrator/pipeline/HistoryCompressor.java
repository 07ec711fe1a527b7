package com.draftsmith.orchestrator.pipeline;

import com.draftsmith.orchestrator.llm.ChatMessage;
import com.draftsmith.orchestrator.llm.ChatModelClient;
import com.draftsmith.orchestrator.llm.ChatRequest;
import com.draftsmith.orchestrator.llm.ModelEndpoint;
import com.draftsmith.orchestrator.llm.StageCallFailedException;
import com.draftsmith.orchestrator.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses a stage's history into a single summarising system entry.
 *
 * Only the most recent entries are sent, together with any earlier summary
 * that has already fallen out of that window, so compression cost stays
 * bounded however long the document is. Failures propagate unchanged.
 */
@Component
public class HistoryCompressor {

    private static final Logger log = LoggerFactory.getLogger(HistoryCompressor.class);

    static final int    RECENT_ENTRIES = 3;
    static final double TEMPERATURE    = 0.3;

    private final ChatModelClient client;
    private final StagePrompts    prompts;

    public HistoryCompressor(ChatModelClient client, StagePrompts prompts) {
        this.client  = client;
        this.prompts = prompts;
    }

    public ChatMessage compress(List<ChatMessage> history, Stage stage, ModelEndpoint endpoint) {
        if (history.size() == 1 && history.get(0).isSystem()) {
            return history.get(0);   // already a summary
        }

        int from = Math.max(0, history.size() - RECENT_ENTRIES);
        List<ChatMessage> recent = history.subList(from, history.size());

        List<String> summaries = new ArrayList<>();
        for (ChatMessage entry : history.subList(0, from)) {
            if (entry.isSystem() && hasContent(entry)) summaries.add(entry.content());
        }
        List<String> outputs = new ArrayList<>();
        for (ChatMessage entry : recent) {
            if (!hasContent(entry)) continue;
            if (entry.isSystem())         summaries.add(entry.content());
            else if (entry.isAssistant()) outputs.add(entry.content());
        }

        log.info("Compressing {} history entries for stage {} via {}", history.size(), stage, endpoint);
        String summary = client.complete(new ChatRequest(
                endpoint, prompts.compressionMessages(stage, summaries, outputs), TEMPERATURE));
        if (summary == null) {
            throw StageCallFailedException.missingContent("content");
        }
        return ChatMessage.system(StagePrompts.SUMMARY_PREFIX + summary);
    }

    private static boolean hasContent(ChatMessage entry) {
        return entry.content() != null && !entry.content().isBlank();
    }
}
