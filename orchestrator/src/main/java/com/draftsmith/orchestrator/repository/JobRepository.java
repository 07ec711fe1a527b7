package com.draftsmith.orchestrator.repository;

import com.draftsmith.orchestrator.model.Job;
import com.draftsmith.orchestrator.model.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the jobs table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    /** All jobs currently in a given status (used for monitoring). */
    List<Job> findByStatus(JobStatus status);

    /**
     * Read a job with SELECT ... FOR UPDATE.
     *
     * Must run inside a @Transactional method; the row stays locked until that
     * transaction commits, so a status check followed by a write cannot
     * interleave with another writer of the same row.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);
}
