package com.draftsmith.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One document submitted for transformation, tracked end to end.
 *
 * Mutated only by the pipeline run that currently owns it; HTTP-triggered
 * reads see the snapshot last written to the database.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    // Assigned on construction; doubles as the opaque session id handed to clients.
    @Id
    private UUID id;

    @Column(name = "original_text", columnDefinition = "TEXT", nullable = false)
    private String originalText;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_mode", nullable = false)
    private ProcessingMode mode;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "model",   column = @Column(name = "polish_model")),
            @AttributeOverride(name = "apiKey",  column = @Column(name = "polish_api_key")),
            @AttributeOverride(name = "baseUrl", column = @Column(name = "polish_base_url"))
    })
    private ModelOverride polishConfig;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "model",   column = @Column(name = "enhance_model")),
            @AttributeOverride(name = "apiKey",  column = @Column(name = "enhance_api_key")),
            @AttributeOverride(name = "baseUrl", column = @Column(name = "enhance_base_url"))
    })
    private ModelOverride enhanceConfig;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "model",   column = @Column(name = "emotion_model")),
            @AttributeOverride(name = "apiKey",  column = @Column(name = "emotion_api_key")),
            @AttributeOverride(name = "baseUrl", column = @Column(name = "emotion_base_url"))
    })
    private ModelOverride emotionConfig;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.QUEUED;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_stage")
    private Stage currentStage;

    @Column(name = "current_position", nullable = false)
    private int currentPosition = 0;

    @Column(name = "total_segments", nullable = false)
    private int totalSegments = 0;

    @Column(nullable = false)
    private double progress = 0.0;

    // Bounded-length message; never a stack trace.
    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // Ordinal of the segment the last run failed on; the next run of that stage resumes here.
    @Column(name = "failed_segment_index")
    private Integer failedSegmentIndex;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(String originalText, ProcessingMode mode) {
        this.id           = UUID.randomUUID();
        this.originalText = originalText;
        this.mode         = mode;
        this.currentStage = mode.firstStage();
    }

    // ------------------------------------------------------------------
    // Model overrides
    // ------------------------------------------------------------------

    /** The job-level override for {@code stage}; never null. */
    public ModelOverride overrideFor(Stage stage) {
        ModelOverride o = switch (stage) {
            case POLISH         -> polishConfig;
            case ENHANCE        -> enhanceConfig;
            case EMOTION_POLISH -> emotionConfig;
        };
        return o == null ? ModelOverride.none() : o;
    }

    public void setOverride(Stage stage, ModelOverride override) {
        switch (stage) {
            case POLISH         -> this.polishConfig  = override;
            case ENHANCE        -> this.enhanceConfig = override;
            case EMOTION_POLISH -> this.emotionConfig = override;
        }
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID           getId()                 { return id; }
    public String         getOriginalText()       { return originalText; }
    public ProcessingMode getMode()               { return mode; }
    public JobStatus      getStatus()             { return status; }
    public Stage          getCurrentStage()       { return currentStage; }
    public int            getCurrentPosition()    { return currentPosition; }
    public int            getTotalSegments()      { return totalSegments; }
    public double         getProgress()           { return progress; }
    public String         getErrorMessage()       { return errorMessage; }
    public Integer        getFailedSegmentIndex() { return failedSegmentIndex; }
    public Instant        getCreatedAt()          { return createdAt; }
    public Instant        getUpdatedAt()          { return updatedAt; }
    public Instant        getCompletedAt()        { return completedAt; }

    public void setStatus(JobStatus status)                 { this.status = status; }
    public void setCurrentStage(Stage currentStage)         { this.currentStage = currentStage; }
    public void setCurrentPosition(int currentPosition)     { this.currentPosition = currentPosition; }
    public void setTotalSegments(int totalSegments)         { this.totalSegments = totalSegments; }
    public void setProgress(double progress)                { this.progress = progress; }
    public void setErrorMessage(String errorMessage)        { this.errorMessage = errorMessage; }
    public void setFailedSegmentIndex(Integer index)        { this.failedSegmentIndex = index; }
    public void setCompletedAt(Instant completedAt)         { this.completedAt = completedAt; }
}
