package com.draftsmith.orchestrator.pipeline;

import com.draftsmith.orchestrator.text.TextMetrics;

/**
 * Lightweight diff stored with each ChangeRecord, serialised as JSON.
 */
public record ChangeSummary(int beforeLength,
                            int afterLength,
                            int beforeChars,
                            int afterChars,
                            boolean changed) {

    public static ChangeSummary of(String before, String after) {
        return new ChangeSummary(
                TextMetrics.measure(before),
                TextMetrics.measure(after),
                before == null ? 0 : before.length(),
                after  == null ? 0 : after.length(),
                before == null ? after != null : !before.equals(after));
    }
}
