package com.eyelevel.contentmoderation.dto.job.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * A content submission. {@code category} and {@code serverTag} fall back to configured defaults.
 */
public record CreateJobRequest(
        @NotBlank(message = "The 'title' field cannot be empty.") @Size(max = 255) String title,
        @NotBlank(message = "The 'content' field cannot be empty.") String content,
        @NotBlank(message = "The 'author' field cannot be empty.") @Size(max = 255) String author,
        @Size(max = 100) String category,
        @Size(max = 100) String serverTag) {
}
