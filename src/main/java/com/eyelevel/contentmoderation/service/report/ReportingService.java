package com.eyelevel.contentmoderation.service.report;

import com.eyelevel.contentmoderation.config.ModerationProperties;
import com.eyelevel.contentmoderation.dto.report.response.CategoryCount;
import com.eyelevel.contentmoderation.dto.report.response.DailyActivity;
import com.eyelevel.contentmoderation.dto.report.response.WorkerProcessingTime;
import com.eyelevel.contentmoderation.model.JobStatus;
import com.eyelevel.contentmoderation.model.ModerationJob;
import com.eyelevel.contentmoderation.repository.ModerationJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only aggregations over the job store for the reporting API. Never mutates pipeline state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReportingService {

    private final ModerationJobRepository jobRepository;
    private final ModerationProperties properties;
    private final Clock clock;

    /**
     * One entry per configured worker, in configuration order. Without configured workers, one entry
     * per worker found in the store.
     */
    public List<WorkerProcessingTime> processingTimes(final String period) {
        final List<ModerationJob> jobs = jobsSince(period);
        final Map<String, List<ModerationJob>> byWorker = jobs.stream()
                                                              .filter(job -> job.getAssignedWorker() != null)
                                                              .collect(Collectors.groupingBy(
                                                                      ModerationJob::getAssignedWorker));

        List<String> workerIds = properties.workerIds();
        if (workerIds.isEmpty()) {
            workerIds = byWorker.keySet().stream().sorted().toList();
        }

        return workerIds.stream()
                        .map(workerId -> toProcessingTime(workerId, byWorker.getOrDefault(workerId, List.of())))
                        .toList();
    }

    /**
     * One bucket per local day, oldest first, ending today.
     */
    public List<DailyActivity> activity(final String period) {
        final int days = ReportPeriod.parse(period)
                                     .map(ReportPeriod::getActivityDays)
                                     .orElse(ReportPeriod.DEFAULT_ACTIVITY_DAYS);
        final ZoneId zone = clock.getZone();
        final LocalDate today = LocalDate.now(clock);
        final LocalDate firstDay = today.minusDays(days - 1L);

        final Map<LocalDate, List<ModerationJob>> byDay =
                jobRepository.findByCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
                                     firstDay.atStartOfDay(zone).toInstant())
                             .stream()
                             .collect(Collectors.groupingBy(job -> job.getCreatedAt().atZone(zone).toLocalDate()));

        final List<DailyActivity> activity = new ArrayList<>(days);
        for (LocalDate date = firstDay; !date.isAfter(today); date = date.plusDays(1)) {
            final List<ModerationJob> dayJobs = byDay.getOrDefault(date, List.of());
            activity.add(new DailyActivity(date.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.US),
                                           date,
                                           count(dayJobs, JobStatus.APPROVED),
                                           count(dayJobs, JobStatus.REJECTED),
                                           count(dayJobs, JobStatus.PENDING) + count(dayJobs, JobStatus.PROCESSING),
                                           count(dayJobs, JobStatus.NEEDS_REVIEW)));
        }
        return activity;
    }

    /**
     * Job counts per category, largest first. Missing categories count as {@code general}.
     */
    public List<CategoryCount> categories(final String period) {
        final String defaultCategory = properties.getIngestion().getDefaultCategory();
        return jobsSince(period).stream()
                                .map(job -> StringUtils.hasText(job.getCategory()) ? job.getCategory() : defaultCategory)
                                .map(ReportingService::capitalize)
                                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()))
                                .entrySet()
                                .stream()
                                .map(entry -> new CategoryCount(entry.getKey(), entry.getValue()))
                                .sorted(Comparator.comparingLong(CategoryCount::count)
                                                  .reversed()
                                                  .thenComparing(CategoryCount::name))
                                .toList();
    }

    private List<ModerationJob> jobsSince(final String period) {
        final Instant since = ReportPeriod.parse(period).map(p -> p.since(clock)).orElse(Instant.EPOCH);
        return jobRepository.findByCreatedAtGreaterThanEqualOrderByCreatedAtDesc(since);
    }

    private static WorkerProcessingTime toProcessingTime(final String workerId, final List<ModerationJob> jobs) {
        final OptionalDouble averageMs = jobs.stream()
                                             .map(ModerationJob::getProcessingDurationMs)
                                             .filter(Objects::nonNull)
                                             .mapToLong(Long::longValue)
                                             .average();
        final long processed = jobs.stream().filter(job -> job.getProcessingDurationMs() != null).count();
        final double averageSeconds = Math.round(averageMs.orElse(0.0) / 100.0) / 10.0;
        return new WorkerProcessingTime(workerId, averageSeconds, processed,
                                        count(jobs, JobStatus.APPROVED),
                                        count(jobs, JobStatus.REJECTED),
                                        count(jobs, JobStatus.NEEDS_REVIEW));
    }

    private static long count(final List<ModerationJob> jobs, final JobStatus status) {
        return jobs.stream().filter(job -> job.getStatus() == status).count();
    }

    private static String capitalize(final String value) {
        final String trimmed = value.trim();
        return trimmed.substring(0, 1).toUpperCase(Locale.ROOT) + trimmed.substring(1);
    }
}
