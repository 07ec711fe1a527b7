package com.draftsmith.orchestrator.pipeline;

import com.draftsmith.orchestrator.model.Stage;

/**
 * A segment's model call (or the compression it triggered) failed.
 * The run stops at this segment; a later retry resumes exactly here.
 */
public class SegmentFailedException extends RuntimeException {

    private final int   segmentIndex;
    private final Stage stage;

    public SegmentFailedException(int segmentIndex, Stage stage, Throwable cause) {
        super("Segment " + (segmentIndex + 1) + " failed during " + stage.wireName()
                + " stage: " + cause.getMessage(), cause);
        this.segmentIndex = segmentIndex;
        this.stage        = stage;
    }

    /** 0-based ordinal of the failing segment. */
    public int getSegmentIndex() { return segmentIndex; }

    public Stage getStage() { return stage; }
}
