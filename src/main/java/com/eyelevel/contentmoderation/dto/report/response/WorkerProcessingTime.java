package com.eyelevel.contentmoderation.dto.report.response;

/**
 * Throughput of one worker over the selected period.
 *
 * @param averageTimeSeconds Mean classification time in seconds, rounded to one decimal.
 * @param processed          Jobs with a recorded processing duration.
 */
public record WorkerProcessingTime(String workerId, double averageTimeSeconds, long processed, long approved,
                                   long rejected, long needsReview) {
}
