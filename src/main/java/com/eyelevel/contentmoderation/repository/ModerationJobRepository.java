package com.eyelevel.contentmoderation.repository;

import com.eyelevel.contentmoderation.model.JobStatus;
import com.eyelevel.contentmoderation.model.ModerationJob;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Spring Data JPA repository for the {@link ModerationJob} entity.
 * <p>
 * Status transitions are single {@code UPDATE} statements keyed by job id. They are unconditional
 * on the previous status, so a redelivered message can always overwrite whatever an earlier attempt
 * left behind, and the database applies each one atomically without any application-side locking.
 */
@Repository
public interface ModerationJobRepository extends JpaRepository<ModerationJob, String> {

    /**
     * Finds jobs created at or after the given instant, newest first. Passing {@link Instant#EPOCH}
     * scans the whole store.
     */
    List<ModerationJob> findByCreatedAtGreaterThanEqualOrderByCreatedAtDesc(Instant since);

    List<ModerationJob> findByStatusAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(JobStatus status, Instant since);

    /**
     * Finds jobs that were persisted but never accepted by the work queue.
     * Used by the {@link com.eyelevel.contentmoderation.service.job.PendingJobReplayService}.
     *
     * @param status    Always {@code PENDING} in practice.
     * @param threshold Only jobs created before this instant are returned, leaving a grace period for
     *                  in-flight ingestion.
     * @param pageable  Bounds the size of one replay pass.
     * @return The matching jobs, oldest first.
     */
    List<ModerationJob> findByStatusAndEnqueuedAtIsNullAndCreatedAtBeforeOrderByCreatedAtAsc(JobStatus status,
                                                                                             Instant threshold,
                                                                                             Pageable pageable);

    long countByStatus(JobStatus status);

    boolean existsByAssignedWorkerAndStatus(String assignedWorker, JobStatus status);

    /**
     * Records that a worker has taken ownership of a job. Clears every decision field so that the
     * {@code completedAt} invariant holds while the job is being re-classified.
     *
     * @return The number of rows updated; {@code 0} if the job does not exist.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ModerationJob j
               SET j.status = :status,
                   j.assignedWorker = :workerId,
                   j.decisionDetail = null,
                   j.score = null,
                   j.reviewReason = null,
                   j.completedAt = null,
                   j.processingDurationMs = null
             WHERE j.id = :jobId
            """)
    int updateToInProgress(@Param("jobId") String jobId,
                           @Param("status") JobStatus status,
                           @Param("workerId") String workerId);

    /**
     * Overwrites the decision fields of a job with the outcome of a classification attempt.
     *
     * @return The number of rows updated; {@code 0} if the job does not exist.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ModerationJob j
               SET j.status = :status,
                   j.assignedWorker = :workerId,
                   j.decisionDetail = :detail,
                   j.score = :score,
                   j.reviewReason = :reviewReason,
                   j.processingDurationMs = :durationMs,
                   j.completedAt = :completedAt
             WHERE j.id = :jobId
            """)
    int updateDecision(@Param("jobId") String jobId,
                       @Param("status") JobStatus status,
                       @Param("workerId") String workerId,
                       @Param("detail") String detail,
                       @Param("score") Double score,
                       @Param("reviewReason") String reviewReason,
                       @Param("durationMs") Long durationMs,
                       @Param("completedAt") Instant completedAt);

    /**
     * Stamps the hand-off time without touching the status, so it can never race a worker's write.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ModerationJob j SET j.enqueuedAt = :enqueuedAt WHERE j.id = :jobId")
    int updateEnqueuedAt(@Param("jobId") String jobId, @Param("enqueuedAt") Instant enqueuedAt);
}
