package com.draftsmith.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * One named transformation pass applied to every segment of a job.
 *
 * A segment carries two derived texts. First-pass stages (polish, emotion
 * polish) write the first one; the enhancement pass reads the first and
 * writes the second.
 */
public enum Stage {
    POLISH("polish", 1),
    ENHANCE("enhance", 2),
    EMOTION_POLISH("emotion_polish", 1);

    private final String wireName;
    private final int    outputSlot;

    Stage(String wireName, int outputSlot) {
        this.wireName   = wireName;
        this.outputSlot = outputSlot;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Text this stage transforms for {@code segment}. */
    public String inputOf(Segment segment) {
        if (outputSlot == 2 && segment.getPolishedText() != null) {
            return segment.getPolishedText();
        }
        return segment.getOriginalText();
    }

    /** Output this stage already produced for {@code segment}, or null. */
    public String outputOf(Segment segment) {
        return outputSlot == 1 ? segment.getPolishedText() : segment.getEnhancedText();
    }

    public void writeOutput(Segment segment, String text) {
        if (outputSlot == 1) {
            segment.setPolishedText(text);
        } else {
            segment.setEnhancedText(text);
        }
    }

    public static Stage fromWireName(String name) {
        return Arrays.stream(values())
                .filter(s -> s.wireName.equalsIgnoreCase(name) || s.name().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown stage: " + name));
    }
}
