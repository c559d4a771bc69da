package com.eyelevel.contentmoderation.dto.report.response;

import java.time.LocalDate;

/**
 * Jobs created on one local day, by status. {@code pending} also counts jobs still in processing.
 *
 * @param day Short weekday label, e.g. {@code Mon}.
 */
public record DailyActivity(String day, LocalDate date, long approved, long rejected, long pending,
                            long needsReview) {
}
