package com.eyelevel.contentmoderation.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single content submission and its moderation decision record.
 * <p>
 * The input fields are written once by ingestion. Status and decision fields are only ever changed
 * through the single-statement updates in
 * {@link com.eyelevel.contentmoderation.repository.ModerationJobRepository}, so no caller holds a
 * long-lived copy of this entity.
 */
@Entity
@Table(name = "moderation_job", indexes = {
        @Index(name = "idx_moderation_job_created_at", columnList = "created_at"),
        @Index(name = "idx_moderation_job_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModerationJob {

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    @Column(nullable = false, updatable = false)
    private String title;

    @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
    private String content;

    @Column(nullable = false, updatable = false)
    private String author;

    @Column(nullable = false, updatable = false)
    private String category;

    @Column(nullable = false, updatable = false)
    private String serverTag;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status;

    /**
     * The worker that currently owns, or last owned, this job. Null until the first pickup.
     */
    @Column
    private String assignedWorker;

    @Column(columnDefinition = "TEXT")
    private String decisionDetail;

    /**
     * The highest sub-score returned by the scoring service. Null for deny-list rejections and
     * degraded decisions.
     */
    @Column
    private Double score;

    @Column
    private String reviewReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Set only when the job enters {@link JobStatus#APPROVED} or {@link JobStatus#REJECTED}.
     */
    @Column
    private Instant completedAt;

    @Column
    private Long processingDurationMs;

    /**
     * When the work item was accepted by the queue. A pending job with no value here was never
     * handed off and is picked up by the replay scheduler.
     */
    @Column
    private Instant enqueuedAt;
}
