package com.eyelevel.contentmoderation.service.report;

import com.eyelevel.contentmoderation.exception.JobValidationException;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The time windows accepted by the query and reporting APIs.
 */
public enum ReportPeriod {
    /**
     * Since local midnight.
     */
    DAY(1),
    /**
     * The last seven days.
     */
    WEEK(7),
    /**
     * The last calendar month.
     */
    MONTH(30),
    /**
     * The last year.
     */
    YEAR(365);

    /**
     * Number of daily activity buckets used when no period is given.
     */
    public static final int DEFAULT_ACTIVITY_DAYS = 7;

    private final int activityDays;

    ReportPeriod(final int activityDays) {
        this.activityDays = activityDays;
    }

    public int getActivityDays() {
        return activityDays;
    }

    /**
     * @return The inclusive lower bound of the window, evaluated against the given clock.
     */
    public Instant since(final Clock clock) {
        final ZonedDateTime now = ZonedDateTime.now(clock);
        return switch (this) {
            case DAY -> LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
            case WEEK -> now.minusDays(7).toInstant();
            case MONTH -> now.minusMonths(1).toInstant();
            case YEAR -> now.minusYears(1).toInstant();
        };
    }

    /**
     * Parses a period parameter. A missing or blank value means "no lower bound".
     *
     * @throws JobValidationException If the value is not one of {@code day, week, month, year}.
     */
    public static Optional<ReportPeriod> parse(final String value) {
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        return Optional.of(Arrays.stream(values())
                                 .filter(period -> period.name().equalsIgnoreCase(value.trim()))
                                 .findFirst()
                                 .orElseThrow(() -> new JobValidationException(
                                         "Unknown period '" + value + "'. Expected one of: day, week, month, year.")));
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
