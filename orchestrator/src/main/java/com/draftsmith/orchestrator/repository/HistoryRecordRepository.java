package com.draftsmith.orchestrator.repository;

import com.draftsmith.orchestrator.model.HistoryRecord;
import com.draftsmith.orchestrator.model.Stage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface HistoryRecordRepository extends JpaRepository<HistoryRecord, UUID> {

    Optional<HistoryRecord> findByJobIdAndStage(UUID jobId, Stage stage);

    Optional<HistoryRecord> findByJobIdAndStageAndCompressedTrue(UUID jobId, Stage stage);
}
