package com.draftsmith.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Before/after audit entry for one (segment, stage) pair.
 * Upserted: re-running a segment replaces its record.
 *
 * DB table: change_records  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "change_records",
       uniqueConstraints = @UniqueConstraint(columnNames = {"job_id", "segment_index", "stage"}))
public class ChangeRecord {

    @Id
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "segment_index", nullable = false, updatable = false)
    private int segmentIndex;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Stage stage;

    @Column(name = "before_text", columnDefinition = "TEXT")
    private String beforeText;

    @Column(name = "after_text", columnDefinition = "TEXT")
    private String afterText;

    // JSON-encoded ChangeSummary.
    @Column(name = "changes_detail", columnDefinition = "TEXT")
    private String changesDetail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    protected ChangeRecord() {}   // required by JPA

    public ChangeRecord(UUID jobId, int segmentIndex, Stage stage) {
        this.id           = UUID.randomUUID();
        this.jobId        = jobId;
        this.segmentIndex = segmentIndex;
        this.stage        = stage;
    }

    public void update(String beforeText, String afterText, String changesDetail) {
        this.beforeText    = beforeText;
        this.afterText     = afterText;
        this.changesDetail = changesDetail;
        this.updatedAt     = Instant.now();
    }

    public UUID    getId()            { return id; }
    public UUID    getJobId()         { return jobId; }
    public int     getSegmentIndex()  { return segmentIndex; }
    public Stage   getStage()         { return stage; }
    public String  getBeforeText()    { return beforeText; }
    public String  getAfterText()     { return afterText; }
    public String  getChangesDetail() { return changesDetail; }
    public Instant getCreatedAt()     { return createdAt; }
    public Instant getUpdatedAt()     { return updatedAt; }
}
