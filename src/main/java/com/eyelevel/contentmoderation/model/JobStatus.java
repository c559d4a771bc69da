package com.eyelevel.contentmoderation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Defines the lifecycle states of a {@link ModerationJob}.
 * <p>
 * {@code PENDING -> PROCESSING -> {APPROVED, REJECTED, NEEDS_REVIEW}}. The lower-case wire value
 * is what clients and reports see.
 */
public enum JobStatus {
    /**
     * The job has been persisted by ingestion and is waiting for a worker to pick it up.
     */
    PENDING("pending"),
    /**
     * A worker holds the queue message for this job and is classifying its content.
     */
    PROCESSING("processing"),
    /**
     * The content passed moderation. Terminal.
     */
    APPROVED("approved"),
    /**
     * The content was rejected by the deny-list or by high scores. Terminal.
     */
    REJECTED("rejected"),
    /**
     * The content was flagged for human evaluation. No re-queue path exists in the pipeline.
     */
    NEEDS_REVIEW("needs_review");

    private final String value;

    JobStatus(final String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @return {@code true} for the statuses that carry a {@code completedAt} timestamp.
     */
    public boolean isCompleted() {
        return this == APPROVED || this == REJECTED;
    }

    /**
     * @return {@code true} if the status can be produced by a classification decision.
     */
    public boolean isDecision() {
        return this == APPROVED || this == REJECTED || this == NEEDS_REVIEW;
    }

    public static Optional<JobStatus> fromValue(final String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                     .filter(status -> status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
                     .findFirst();
    }

    @JsonCreator
    static JobStatus fromJson(final String value) {
        return fromValue(value).orElseThrow(() -> new IllegalArgumentException("Unknown job status: " + value));
    }
}
