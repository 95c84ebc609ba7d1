package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.Job;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for Job entity
 */
@Repository
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Jobs the scheduler should hold in memory
     */
    List<Job> findByActiveTrue();

    /**
     * All jobs, newest first
     */
    List<Job> findAllByOrderByCreatedAtDesc();

    /**
     * Deactivate a job whose schedule has run out, provided it is still at the given version
     *
     * @return number of rows updated (0 if the job no longer exists or was modified since)
     */
    @Modifying
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.active = false,
                j.updatedAt = :now,
                j.version = j.version + 1
            WHERE j.id = :jobId
            AND j.version = :version
            """)
    int markInactive(@Param("jobId") UUID jobId, @Param("version") Long version, @Param("now") Instant now);

    long countByActive(boolean active);
}
