package com.eyelevel.contentmoderation.service.job;

import com.eyelevel.contentmoderation.model.Decision;
import com.eyelevel.contentmoderation.model.JobStatus;
import com.eyelevel.contentmoderation.model.ModerationJob;
import com.eyelevel.contentmoderation.repository.ModerationJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Instant;

/**
 * The single writer of job state. Every method is one atomic statement against the store and is
 * retried on transient store failures before the error is propagated to the caller.
 * <p>
 * Transitions are keyed by job id only and never check the previous status: the last write wins.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStateManager {

    private final ModerationJobRepository jobRepository;

    /**
     * Persists a freshly ingested job.
     */
    @Retryable(retryFor = {TransientDataAccessException.class, DataAccessResourceFailureException.class,
                           CannotCreateTransactionException.class},
            maxAttemptsExpression = "#{${app.moderation.store.retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.moderation.store.retry.delay-ms:500}}"),
            listeners = {"jobStoreRetryListener"})
    public ModerationJob create(final ModerationJob job) {
        final ModerationJob saved = jobRepository.saveAndFlush(job);
        log.info("Created moderation job {} with status {}.", saved.getId(), saved.getStatus().getValue());
        return saved;
    }

    /**
     * Claims a job for a worker: status {@code processing}, the worker recorded as owner and every
     * decision field cleared.
     *
     * @return {@code false} if no job with that id exists.
     */
    @Retryable(retryFor = {TransientDataAccessException.class, DataAccessResourceFailureException.class,
                           CannotCreateTransactionException.class},
            maxAttemptsExpression = "#{${app.moderation.store.retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.moderation.store.retry.delay-ms:500}}"),
            listeners = {"jobStoreRetryListener"})
    public boolean markProcessing(final String jobId, final String workerId) {
        final int updated = jobRepository.updateToInProgress(jobId, JobStatus.PROCESSING, workerId);
        log.debug("Marked job {} as processing by {} ({} row(s)).", jobId, workerId, updated);
        return updated > 0;
    }

    /**
     * Records the outcome of a classification attempt. {@code completedAt} is written only for
     * {@code approved} and {@code rejected}; it is cleared for {@code needs_review}.
     *
     * @return {@code false} if no job with that id exists.
     */
    @Retryable(retryFor = {TransientDataAccessException.class, DataAccessResourceFailureException.class,
                           CannotCreateTransactionException.class},
            maxAttemptsExpression = "#{${app.moderation.store.retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.moderation.store.retry.delay-ms:500}}"),
            listeners = {"jobStoreRetryListener"})
    public boolean recordDecision(final String jobId, final String workerId, final Decision decision,
                                  final long durationMs, final Instant decidedAt) {
        final Instant completedAt = decision.status().isCompleted() ? decidedAt : null;
        final int updated = jobRepository.updateDecision(jobId, decision.status(), workerId, decision.detail(),
                                                         decision.score(), decision.reviewReason(), durationMs,
                                                         completedAt);
        return updated > 0;
    }

    /**
     * Records that the job's work item was accepted by the queue. Leaves the status untouched.
     */
    @Retryable(retryFor = {TransientDataAccessException.class, DataAccessResourceFailureException.class,
                           CannotCreateTransactionException.class},
            maxAttemptsExpression = "#{${app.moderation.store.retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.moderation.store.retry.delay-ms:500}}"),
            listeners = {"jobStoreRetryListener"})
    public boolean markEnqueued(final String jobId, final Instant enqueuedAt) {
        return jobRepository.updateEnqueuedAt(jobId, enqueuedAt) > 0;
    }
}
