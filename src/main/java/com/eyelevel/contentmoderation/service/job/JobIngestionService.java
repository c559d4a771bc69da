package com.eyelevel.contentmoderation.service.job;

import com.eyelevel.contentmoderation.config.ModerationProperties;
import com.eyelevel.contentmoderation.dto.job.request.CreateJobRequest;
import com.eyelevel.contentmoderation.dto.queue.WorkItem;
import com.eyelevel.contentmoderation.exception.JobValidationException;
import com.eyelevel.contentmoderation.exception.QueueUnavailableException;
import com.eyelevel.contentmoderation.model.JobStatus;
import com.eyelevel.contentmoderation.model.ModerationJob;
import com.eyelevel.contentmoderation.service.queue.WorkQueuePublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Accepts content submissions: validates them, persists a {@code pending} job and hands a
 * {@link WorkItem} to the work queue.
 * <p>
 * A queue outage never fails a submission. The job stays {@code pending} with no enqueue time and the
 * {@link PendingJobReplayService} publishes it once the queue is back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobIngestionService {

    private final JobStateManager jobStateManager;
    private final WorkQueuePublisher workQueuePublisher;
    private final ModerationProperties properties;
    private final Clock clock;

    /**
     * @return The persisted job. Its status is always {@code pending}.
     *
     * @throws JobValidationException If title, content or author is missing or blank.
     */
    public ModerationJob submit(final CreateJobRequest request) {
        if (request == null) {
            throw new JobValidationException("A submission body is required.");
        }
        requireText("title", request.title());
        requireText("content", request.content());
        requireText("author", request.author());

        final ModerationJob job = ModerationJob.builder()
                                               .id(UUID.randomUUID().toString())
                                               .title(request.title())
                                               .content(request.content())
                                               .author(request.author())
                                               .category(StringUtils.hasText(request.category())
                                                                 ? request.category().trim()
                                                                 : properties.getIngestion().getDefaultCategory())
                                               .serverTag(StringUtils.hasText(request.serverTag())
                                                                  ? request.serverTag().trim()
                                                                  : properties.getIngestion().getServerTag())
                                               .status(JobStatus.PENDING)
                                               .createdAt(Instant.now(clock))
                                               .build();

        final ModerationJob saved = jobStateManager.create(job);
        enqueue(saved);
        return saved;
    }

    private void enqueue(final ModerationJob job) {
        try {
            workQueuePublisher.publish(WorkItem.from(job));
        } catch (final QueueUnavailableException e) {
            log.warn("Work queue unavailable. Job {} stays pending until it is replayed: {}", job.getId(),
                     e.getMessage());
            return;
        }

        final Instant enqueuedAt = Instant.now(clock);
        try {
            jobStateManager.markEnqueued(job.getId(), enqueuedAt);
            job.setEnqueuedAt(enqueuedAt);
            log.info("Job {} handed to the work queue.", job.getId());
        } catch (final DataAccessException e) {
            log.warn("Job {} was published but its enqueue time could not be recorded. It may be published again.",
                     job.getId(), e);
        }
    }

    private static void requireText(final String field, final String value) {
        if (!StringUtils.hasText(value)) {
            throw new JobValidationException("The '" + field + "' field is required and cannot be blank.");
        }
    }
}
