package com.draftsmith.orchestrator.repository;

import com.draftsmith.orchestrator.model.ChangeRecord;
import com.draftsmith.orchestrator.model.Stage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Audit trail queries for the change_records table.
 * (job_id, segment_index, stage) is unique, so the single-row finder backs upserts.
 */
public interface ChangeRecordRepository extends JpaRepository<ChangeRecord, UUID> {

    Optional<ChangeRecord> findByJobIdAndSegmentIndexAndStage(UUID jobId, int segmentIndex, Stage stage);

    List<ChangeRecord> findByJobIdOrderBySegmentIndexAsc(UUID jobId);
}
