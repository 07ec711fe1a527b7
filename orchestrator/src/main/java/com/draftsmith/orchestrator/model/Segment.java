package com.draftsmith.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One bounded-size chunk of a job's text; the unit of model invocation.
 *
 * Ordinals are contiguous from 0 and never change once created. Each
 * derived text is written at most once per retry cycle: a run skips
 * segments that already carry output for the stage being executed.
 *
 * DB table: segments  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "segments")
public class Segment {

    @Id
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "segment_index", nullable = false, updatable = false)
    private int segmentIndex;

    // Stage the segment was last worked on under.
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Stage stage;

    @Column(name = "original_text", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String originalText;

    // First-pass output (polish or emotion polish).
    @Column(name = "polished_text", columnDefinition = "TEXT")
    private String polishedText;

    // Second-pass output (enhance).
    @Column(name = "enhanced_text", columnDefinition = "TEXT")
    private String enhancedText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SegmentStatus status = SegmentStatus.PENDING;

    // Too short to be worth a model call (titles, section numbers); copied through unchanged.
    @Column(name = "is_trivial", nullable = false)
    private boolean trivial = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Segment() {}   // required by JPA

    public Segment(UUID jobId, int segmentIndex, Stage stage, String originalText) {
        this.id           = UUID.randomUUID();
        this.jobId        = jobId;
        this.segmentIndex = segmentIndex;
        this.stage        = stage;
        this.originalText = originalText;
    }

    /** Copy this segment through unchanged for every stage. */
    public void markPassThrough(Stage stage) {
        this.trivial      = true;
        this.stage        = stage;
        this.polishedText = originalText;
        this.enhancedText = originalText;
        this.status       = SegmentStatus.COMPLETED;
        this.completedAt  = Instant.now();
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()           { return id; }
    public UUID          getJobId()        { return jobId; }
    public int           getSegmentIndex() { return segmentIndex; }
    public Stage         getStage()        { return stage; }
    public String        getOriginalText() { return originalText; }
    public String        getPolishedText() { return polishedText; }
    public String        getEnhancedText() { return enhancedText; }
    public SegmentStatus getStatus()       { return status; }
    public boolean       isTrivial()       { return trivial; }
    public Instant       getCreatedAt()    { return createdAt; }
    public Instant       getCompletedAt()  { return completedAt; }

    public void setStage(Stage stage)                { this.stage = stage; }
    public void setPolishedText(String polishedText) { this.polishedText = polishedText; }
    public void setEnhancedText(String enhancedText) { this.enhancedText = enhancedText; }
    public void setStatus(SegmentStatus status)      { this.status = status; }
    public void setCompletedAt(Instant completedAt)  { this.completedAt = completedAt; }

    /** Best available text: enhanced, else polished, else original. */
    public String finalText() {
        if (enhancedText != null) return enhancedText;
        if (polishedText != null) return polishedText;
        return originalText;
    }
}
