package com.eyelevel.contentmoderation.service.job;

import com.eyelevel.contentmoderation.config.ModerationProperties;
import com.eyelevel.contentmoderation.dto.queue.WorkItem;
import com.eyelevel.contentmoderation.exception.MessageProcessingFailedException;
import com.eyelevel.contentmoderation.model.Decision;
import com.eyelevel.contentmoderation.service.classifier.ContentClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Runs one delivery of a work item through the job state machine:
 * {@code processing} is recorded before classification, the decision after it.
 * <p>
 * Returning normally means the outcome is durable and the message may be acknowledged. Any store
 * failure is raised as a {@link MessageProcessingFailedException} so the message is redelivered.
 * Redelivery simply repeats both writes. A classifier fault never blocks acknowledgement: the job is
 * flagged for human review instead.
 */
@Slf4j
@Service
public class JobProcessingService {

    private final JobStateManager jobStateManager;
    private final ContentClassifier contentClassifier;
    private final Clock clock;
    private final String workerId;

    public JobProcessingService(final JobStateManager jobStateManager, final ContentClassifier contentClassifier,
                                final Clock clock, final ModerationProperties properties) {
        this.jobStateManager = jobStateManager;
        this.contentClassifier = contentClassifier;
        this.clock = clock;
        this.workerId = properties.getWorker().getId();
    }

    public String getWorkerId() {
        return workerId;
    }

    public void process(final WorkItem workItem) {
        if (workItem == null || !workItem.isProcessable()) {
            log.error("[{}] Work item is missing an id or content and will be dropped: {}", workerId, workItem);
            return;
        }

        final String jobId = workItem.id();
        log.info("[{}] Processing job {}.", workerId, jobId);

        final boolean claimed;
        try {
            claimed = jobStateManager.markProcessing(jobId, workerId);
        } catch (final RuntimeException e) {
            log.error("[{}] Could not mark job {} as processing. Leaving the message for redelivery.", workerId,
                      jobId, e);
            throw new MessageProcessingFailedException("Failed to mark job " + jobId + " as processing", e);
        }
        if (!claimed) {
            log.warn("[{}] Job {} does not exist in the store. Acknowledging the message without a decision.",
                     workerId, jobId);
            return;
        }

        final long startedAt = System.nanoTime();
        Decision decision;
        try {
            decision = contentClassifier.classify(workItem.content());
        } catch (final RuntimeException e) {
            log.error("[{}] Classifier failed unexpectedly for job {}. Flagging it for human review.", workerId,
                      jobId, e);
            decision = ContentClassifier.scoringUnavailable();
        }
        final long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        final boolean recorded;
        try {
            recorded = jobStateManager.recordDecision(jobId, workerId, decision, durationMs, Instant.now(clock));
        } catch (final RuntimeException e) {
            log.error("[{}] Could not record decision {} for job {}. Leaving the message for redelivery.", workerId,
                      decision.status().getValue(), jobId, e);
            throw new MessageProcessingFailedException("Failed to record the decision for job " + jobId, e);
        }
        if (!recorded) {
            log.warn("[{}] Job {} disappeared before its decision could be recorded.", workerId, jobId);
            return;
        }

        log.info("[{}] Job {} finished as {} in {} ms.", workerId, jobId, decision.status().getValue(), durationMs);
    }
}
