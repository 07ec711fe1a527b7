package com.draftsmith.orchestrator.pipeline;

import com.draftsmith.orchestrator.llm.ChatMessage;
import com.draftsmith.orchestrator.text.TextMetrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Prior segment outputs carried as context into the next model call of a stage.
 *
 * Raw form holds one assistant entry per processed segment. Once compressed it
 * is a single system entry summarising everything before it. The size counter
 * uses {@link TextMetrics#measure(String)} so it matches the compression threshold.
 *
 * Not thread-safe; owned by one pipeline run.
 */
public class HistoryContext {

    private final List<ChatMessage> entries = new ArrayList<>();
    private int size;

    public static HistoryContext empty() {
        return new HistoryContext();
    }

    /** Start from previously persisted entries (normally one compressed summary). */
    public static HistoryContext seededWith(List<ChatMessage> persisted) {
        HistoryContext history = new HistoryContext();
        for (ChatMessage entry : persisted) {
            history.entries.add(entry);
            history.size += TextMetrics.measure(entry.content());
        }
        return history;
    }

    public void append(String output) {
        entries.add(ChatMessage.assistant(output));
        size += TextMetrics.measure(output);
    }

    /** Replace everything with {@code summary} and reset the size counter to its measured length. */
    public void replaceWithSummary(ChatMessage summary) {
        entries.clear();
        entries.add(summary);
        size = TextMetrics.measure(summary.content());
    }

    public boolean exceeds(int threshold) {
        return size > threshold;
    }

    public boolean isCompressed() {
        return entries.size() == 1 && entries.get(0).isSystem();
    }

    public List<ChatMessage> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
