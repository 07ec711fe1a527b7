package com.draftsmith.orchestrator.repository;

import com.draftsmith.orchestrator.model.Segment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + ordered lookup for the segments table.
 */
public interface SegmentRepository extends JpaRepository<Segment, UUID> {

    /** All segments of a job in ordinal order. */
    List<Segment> findByJobIdOrderBySegmentIndexAsc(UUID jobId);
}
