package com.draftsmith.orchestrator.repository;

import com.draftsmith.orchestrator.model.ChangeRecord;
import com.draftsmith.orchestrator.model.HistoryRecord;
import com.draftsmith.orchestrator.model.Job;
import com.draftsmith.orchestrator.model.JobStatus;
import com.draftsmith.orchestrator.model.Segment;
import com.draftsmith.orchestrator.model.Stage;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link PipelineStore} backed by the Spring Data repositories.
 *
 * Each call is its own transaction. The pipeline writes after every segment,
 * so a crash loses at most the segment that was in flight.
 */
@Component
public class JpaPipelineStore implements PipelineStore {

    private final JobRepository           jobRepo;
    private final SegmentRepository       segmentRepo;
    private final HistoryRecordRepository historyRepo;
    private final ChangeRecordRepository  changeRepo;

    public JpaPipelineStore(JobRepository jobRepo,
                            SegmentRepository segmentRepo,
                            HistoryRecordRepository historyRepo,
                            ChangeRecordRepository changeRepo) {
        this.jobRepo     = jobRepo;
        this.segmentRepo = segmentRepo;
        this.historyRepo = historyRepo;
        this.changeRepo  = changeRepo;
    }

    // ------------------------------------------------------------------
    // Jobs and segments
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public Job saveJob(Job job) {
        return jobRepo.save(job);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Job> findJob(UUID jobId) {
        return jobRepo.findById(jobId);
    }

    @Override
    @Transactional
    public Optional<Job> stopIfStoppable(UUID jobId, String reason) {
        return jobRepo.findByIdForUpdate(jobId)
                .filter(job -> job.getStatus().isStoppable())
                .map(job -> {
                    job.setStatus(JobStatus.STOPPED);
                    job.setErrorMessage(reason);
                    return jobRepo.save(job);
                });
    }

    @Override
    @Transactional(readOnly = true)
    public List<Job> findJobsByStatus(JobStatus status) {
        return jobRepo.findByStatus(status);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Segment> findSegments(UUID jobId) {
        return segmentRepo.findByJobIdOrderBySegmentIndexAsc(jobId);
    }

    @Override
    @Transactional
    public List<Segment> saveSegments(List<Segment> segments) {
        return segmentRepo.saveAll(segments);
    }

    @Override
    @Transactional
    public Segment saveSegment(Segment segment) {
        return segmentRepo.save(segment);
    }

    // ------------------------------------------------------------------
    // History and audit (upserts)
    // ------------------------------------------------------------------

    @Override
    @Transactional(readOnly = true)
    public Optional<HistoryRecord> findCompressedHistory(UUID jobId, Stage stage) {
        return historyRepo.findByJobIdAndStageAndCompressedTrue(jobId, stage);
    }

    @Override
    @Transactional
    public HistoryRecord saveCompressedHistory(UUID jobId, Stage stage, String historyData,
                                               int characterCount, int coveredThrough) {
        HistoryRecord record = historyRepo.findByJobIdAndStage(jobId, stage)
                .orElseGet(() -> new HistoryRecord(jobId, stage));
        record.update(historyData, characterCount, coveredThrough);
        return historyRepo.save(record);
    }

    @Override
    @Transactional
    public ChangeRecord saveChange(UUID jobId, int segmentIndex, Stage stage,
                                   String beforeText, String afterText, String changesDetail) {
        ChangeRecord record = changeRepo.findByJobIdAndSegmentIndexAndStage(jobId, segmentIndex, stage)
                .orElseGet(() -> new ChangeRecord(jobId, segmentIndex, stage));
        record.update(beforeText, afterText, changesDetail);
        return changeRepo.save(record);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChangeRecord> findChanges(UUID jobId) {
        return changeRepo.findByJobIdOrderBySegmentIndexAsc(jobId);
    }
}
