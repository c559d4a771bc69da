package com.eyelevel.contentmoderation.service.job;

import com.eyelevel.contentmoderation.config.ModerationProperties;
import com.eyelevel.contentmoderation.dto.queue.WorkItem;
import com.eyelevel.contentmoderation.exception.QueueUnavailableException;
import com.eyelevel.contentmoderation.model.JobStatus;
import com.eyelevel.contentmoderation.model.ModerationJob;
import com.eyelevel.contentmoderation.repository.ModerationJobRepository;
import com.eyelevel.contentmoderation.service.queue.QueueConnectionSupervisor;
import com.eyelevel.contentmoderation.service.queue.WorkQueuePublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Republishes jobs that were persisted but never accepted by the work queue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PendingJobReplayService {

    private final ModerationJobRepository jobRepository;
    private final WorkQueuePublisher workQueuePublisher;
    private final QueueConnectionSupervisor connectionSupervisor;
    private final JobStateManager jobStateManager;
    private final ModerationProperties properties;
    private final Clock clock;

    private final ReentrantLock replayLock = new ReentrantLock();

    /**
     * Runs one replay pass over at most {@code app.moderation.replay.batch-size} jobs, oldest first.
     * A pass stops at the first publish failure. Concurrent calls are skipped. Job store failures are
     * logged and never thrown; the next pass picks up whatever was missed.
     *
     * @return The number of jobs handed to the queue.
     */
    public int replayPendingJobs() {
        if (!connectionSupervisor.isReady()) {
            log.debug("Skipping pending job replay: work queue is {}.", connectionSupervisor.getState());
            return 0;
        }
        if (!replayLock.tryLock()) {
            log.debug("A pending job replay is already running.");
            return 0;
        }
        try {
            final ModerationProperties.Replay replay = properties.getReplay();
            final Instant threshold = Instant.now(clock).minusSeconds(replay.getGracePeriodSeconds());
            final List<ModerationJob> candidates;
            try {
                candidates = jobRepository.findByStatusAndEnqueuedAtIsNullAndCreatedAtBeforeOrderByCreatedAtAsc(
                        JobStatus.PENDING, threshold, PageRequest.of(0, replay.getBatchSize()));
            } catch (final DataAccessException | TransactionException e) {
                log.warn("Skipping pending job replay: the job store could not be read: {}", e.getMessage());
                return 0;
            }
            if (candidates.isEmpty()) {
                return 0;
            }

            log.info("Replaying {} pending job(s) that never reached the work queue.", candidates.size());
            int published = 0;
            for (final ModerationJob job : candidates) {
                try {
                    workQueuePublisher.publish(WorkItem.from(job));
                } catch (final QueueUnavailableException e) {
                    log.warn("Replay stopped after {} job(s): {}", published, e.getMessage());
                    break;
                }
                published++;
                try {
                    jobStateManager.markEnqueued(job.getId(), Instant.now(clock));
                } catch (final DataAccessException | TransactionException e) {
                    log.warn("Job {} was republished but its enqueue time could not be recorded: {}", job.getId(),
                             e.getMessage());
                }
            }
            log.info("Replayed {} of {} pending job(s).", published, candidates.size());
            return published;
        } finally {
            replayLock.unlock();
        }
    }
}
