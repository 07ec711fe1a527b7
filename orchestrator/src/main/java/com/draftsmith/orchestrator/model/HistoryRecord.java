package com.draftsmith.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted compressed conversation history for one (job, stage).
 *
 * Only the compressed form is ever stored; raw history is rebuilt from
 * segment outputs. At most one row per (job, stage), updated in place.
 *
 * DB table: history_records  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "history_records",
       uniqueConstraints = @UniqueConstraint(columnNames = {"job_id", "stage"}))
public class HistoryRecord {

    @Id
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Stage stage;

    // JSON array of {role, content} objects.
    @Column(name = "history_data", columnDefinition = "TEXT", nullable = false)
    private String historyData;

    @Column(nullable = false)
    private boolean compressed = true;

    // Measured size (TextMetrics) of the stored history.
    @Column(name = "character_count", nullable = false)
    private int characterCount;

    // Last segment ordinal folded into the summary.
    @Column(name = "covered_through", nullable = false)
    private int coveredThrough;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    protected HistoryRecord() {}   // required by JPA

    public HistoryRecord(UUID jobId, Stage stage) {
        this.id    = UUID.randomUUID();
        this.jobId = jobId;
        this.stage = stage;
    }

    public void update(String historyData, int characterCount, int coveredThrough) {
        this.historyData    = historyData;
        this.characterCount = characterCount;
        this.coveredThrough = coveredThrough;
        this.compressed     = true;
        this.updatedAt      = Instant.now();
    }

    public UUID    getId()             { return id; }
    public UUID    getJobId()          { return jobId; }
    public Stage   getStage()          { return stage; }
    public String  getHistoryData()    { return historyData; }
    public boolean isCompressed()      { return compressed; }
    public int     getCharacterCount() { return characterCount; }
    public int     getCoveredThrough() { return coveredThrough; }
    public Instant getCreatedAt()      { return createdAt; }
    public Instant getUpdatedAt()      { return updatedAt; }
}
