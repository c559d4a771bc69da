package com.eyelevel.contentmoderation.service.job;

import com.eyelevel.contentmoderation.dto.job.response.JobListResponse;
import com.eyelevel.contentmoderation.dto.job.response.JobStats;
import com.eyelevel.contentmoderation.exception.JobNotFoundException;
import com.eyelevel.contentmoderation.exception.JobValidationException;
import com.eyelevel.contentmoderation.model.JobStatus;
import com.eyelevel.contentmoderation.model.ModerationJob;
import com.eyelevel.contentmoderation.repository.ModerationJobRepository;
import com.eyelevel.contentmoderation.service.report.ReportPeriod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to moderation jobs for the query API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JobQueryService {

    static final String ALL_STATUSES = "all";

    private final ModerationJobRepository jobRepository;
    private final Clock clock;

    public ModerationJob getJob(final String jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * @param status {@code all}, a status value such as {@code needs_review}, or null for all.
     * @param period {@code day}, {@code week}, {@code month}, {@code year}, or null for no lower bound.
     *
     * @throws JobValidationException If either filter value is unknown.
     */
    public JobListResponse listJobs(final String status, final String period) {
        final Optional<JobStatus> statusFilter = parseStatus(status);
        final Instant since = ReportPeriod.parse(period).map(p -> p.since(clock)).orElse(Instant.EPOCH);
        log.debug("Listing jobs with status {} created since {}.", statusFilter.orElse(null), since);

        final List<ModerationJob> jobs = statusFilter
                .map(value -> jobRepository.findByStatusAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(value, since))
                .orElseGet(() -> jobRepository.findByCreatedAtGreaterThanEqualOrderByCreatedAtDesc(since));

        return new JobListResponse(jobs, stats());
    }

    public JobStats stats() {
        return new JobStats(jobRepository.count(),
                            jobRepository.countByStatus(JobStatus.APPROVED),
                            jobRepository.countByStatus(JobStatus.REJECTED),
                            jobRepository.countByStatus(JobStatus.PENDING),
                            jobRepository.countByStatus(JobStatus.PROCESSING),
                            jobRepository.countByStatus(JobStatus.NEEDS_REVIEW));
    }

    private static Optional<JobStatus> parseStatus(final String status) {
        if (!StringUtils.hasText(status) || ALL_STATUSES.equalsIgnoreCase(status.trim())) {
            return Optional.empty();
        }
        return Optional.of(JobStatus.fromValue(status.trim())
                                    .orElseThrow(() -> new JobValidationException("Unknown status '" + status + "'.")));
    }
}
