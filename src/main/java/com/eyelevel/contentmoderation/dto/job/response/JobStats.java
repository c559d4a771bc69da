package com.eyelevel.contentmoderation.dto.job.response;

/**
 * Whole-store job counts by status.
 */
public record JobStats(long total, long approved, long rejected, long pending, long processing, long needsReview) {
}
