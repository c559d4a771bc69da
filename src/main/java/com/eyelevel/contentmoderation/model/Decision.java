package com.eyelevel.contentmoderation.model;

import java.util.Objects;

/**
 * The outcome of classifying a piece of content.
 *
 * @param status       One of {@link JobStatus#APPROVED}, {@link JobStatus#REJECTED} or {@link JobStatus#NEEDS_REVIEW}.
 * @param detail       A human-readable explanation of the decision.
 * @param score        The highest sub-score from the scoring service, or {@code null} if no score was used.
 * @param reviewReason Why the content needs human review; {@code null} unless the status is {@code NEEDS_REVIEW}.
 */
public record Decision(JobStatus status, String detail, Double score, String reviewReason) {

    public Decision {
        Objects.requireNonNull(status, "status must not be null");
        if (!status.isDecision()) {
            throw new IllegalArgumentException("A decision cannot carry the status " + status);
        }
        if (status != JobStatus.NEEDS_REVIEW && reviewReason != null) {
            throw new IllegalArgumentException("Only NEEDS_REVIEW decisions carry a review reason");
        }
    }

    public static Decision approved(final String detail, final Double score) {
        return new Decision(JobStatus.APPROVED, detail, score, null);
    }

    public static Decision rejected(final String detail, final Double score) {
        return new Decision(JobStatus.REJECTED, detail, score, null);
    }

    public static Decision needsReview(final String detail, final Double score, final String reviewReason) {
        return new Decision(JobStatus.NEEDS_REVIEW, detail, score, reviewReason);
    }
}
