package com.deferq;

import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface JobRepository extends JpaRepository<Job, Long> {

    /**
     * Aggregated status counters fetched in a single query.
     */
    interface StatusCounts {
        Long getScheduledCount();

        Long getLockedCount();

        Long getFailedCount();

        Long getRecurringCount();

        Long getTotalCount();
    }

    @Query("""
            SELECT j.id FROM Job j
            WHERE (j.lockedAt IS NULL OR j.lockedAt <= :lockThreshold)
              AND j.performAt <= :now
              AND (j.numberAttempts <= :maxAttempts OR j.frequency <> '')
            ORDER BY j.performAt ASC, j.id ASC
            """)
    List<Long> findEligibleIds(
            @Param("now") OffsetDateTime now,
            @Param("lockThreshold") OffsetDateTime lockThreshold,
            @Param("maxAttempts") long maxAttempts,
            Pageable pageable);

    @Query("""
            SELECT j.id FROM Job j
            WHERE j.queue = :queue
              AND (j.lockedAt IS NULL OR j.lockedAt <= :lockThreshold)
              AND j.performAt <= :now
              AND (j.numberAttempts <= :maxAttempts OR j.frequency <> '')
            ORDER BY j.performAt ASC, j.id ASC
            """)
    List<Long> findEligibleIdsInQueue(
            @Param("queue") String queue,
            @Param("now") OffsetDateTime now,
            @Param("lockThreshold") OffsetDateTime lockThreshold,
            @Param("maxAttempts") long maxAttempts,
            Pageable pageable);

    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<Job> findAllByOrderByIdAsc();

    boolean existsByNameAndFrequencyNot(String name, String frequency);

    @Query("""
            SELECT
              COALESCE(SUM(CASE
                WHEN (j.lockedAt IS NULL OR j.lockedAt <= :lockThreshold) AND j.failedAt IS NULL
                THEN 1 ELSE 0 END), 0) AS scheduledCount,
              COALESCE(SUM(CASE
                WHEN j.lockedAt > :lockThreshold
                THEN 1 ELSE 0 END), 0) AS lockedCount,
              COALESCE(SUM(CASE
                WHEN j.failedAt IS NOT NULL
                THEN 1 ELSE 0 END), 0) AS failedCount,
              COALESCE(SUM(CASE
                WHEN j.frequency <> ''
                THEN 1 ELSE 0 END), 0) AS recurringCount,
              COUNT(j) AS totalCount
            FROM Job j
            """)
    StatusCounts countStatuses(@Param("lockThreshold") OffsetDateTime lockThreshold);

    @Modifying
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.numberAttempts = j.numberAttempts + 1,
                j.updatedAt = :now
            WHERE j.id = :id
            """)
    int incrementAttempts(@Param("id") Long id, @Param("now") OffsetDateTime now);

    @Modifying
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.performAt = :performAt,
                j.updatedAt = :now
            WHERE j.id = :id
            """)
    int reschedule(
            @Param("id") Long id,
            @Param("performAt") OffsetDateTime performAt,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.lastError = :lastError,
                j.failedAt = :now,
                j.performAt = :performAt,
                j.updatedAt = :now
            WHERE j.id = :id
            """)
    int markFailed(
            @Param("id") Long id,
            @Param("lastError") String lastError,
            @Param("performAt") OffsetDateTime performAt,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.lastError = '',
                j.failedAt = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.failedAt IS NOT NULL
            """)
    int unfail(@Param("id") Long id, @Param("now") OffsetDateTime now);

    @Modifying
    @Transactional
    @Query("DELETE FROM Job j WHERE j.id = :id")
    int deleteJobById(@Param("id") Long id);
}
