package com.eyelevel.contentmoderation.dto.queue;

import com.eyelevel.contentmoderation.model.ModerationJob;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The queue payload for one moderation job: a snapshot of the job's immutable input fields taken at
 * enqueue time. Workers use it only as a pointer to {@code id} plus the content to classify.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkItem(String id, String title, String content, String author, String category, String serverTag) {

    public static WorkItem from(final ModerationJob job) {
        return new WorkItem(job.getId(), job.getTitle(), job.getContent(), job.getAuthor(), job.getCategory(),
                            job.getServerTag());
    }

    public boolean isProcessable() {
        return id != null && !id.isBlank() && content != null;
    }
}
