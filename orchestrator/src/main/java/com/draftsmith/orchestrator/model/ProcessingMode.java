package com.draftsmith.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The fixed set of stage sequences a job can run.
 */
public enum ProcessingMode {
    PAPER_POLISH("paper_polish", List.of(Stage.POLISH)),
    PAPER_POLISH_ENHANCE("paper_polish_enhance", List.of(Stage.POLISH, Stage.ENHANCE)),
    EMOTION_POLISH("emotion_polish", List.of(Stage.EMOTION_POLISH));

    private final String      wireName;
    private final List<Stage> stages;

    ProcessingMode(String wireName, List<Stage> stages) {
        this.wireName = wireName;
        this.stages   = stages;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Stages in execution order. */
    public List<Stage> stages() {
        return stages;
    }

    public Stage firstStage() {
        return stages.get(0);
    }

    /**
     * Percentage complete when {@code stage} is about to process segment
     * {@code index} of {@code total}. Each stage owns an equal share of 0-100.
     */
    public double progress(Stage stage, int index, int total) {
        if (total <= 0) return 0.0;
        int position = stages.indexOf(stage);
        if (position < 0) {
            throw new IllegalArgumentException(stage + " is not part of mode " + wireName);
        }
        double share = 100.0 / stages.size();
        return Math.min(100.0, share * position + share * index / total);
    }

    public static ProcessingMode fromWireName(String name) {
        if (name == null) throw new UnknownProcessingModeException(null);
        return Arrays.stream(values())
                .filter(m -> m.wireName.equalsIgnoreCase(name) || m.name().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new UnknownProcessingModeException(name));
    }

    static String supportedWireNames() {
        return Arrays.stream(values()).map(ProcessingMode::wireName).collect(Collectors.joining(", "));
    }
}
