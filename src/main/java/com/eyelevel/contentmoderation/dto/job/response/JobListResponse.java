package com.eyelevel.contentmoderation.dto.job.response;

import com.eyelevel.contentmoderation.model.ModerationJob;

import java.util.List;

/**
 * @param jobs  The jobs matching the filter, newest first.
 * @param stats Counts across the whole store, independent of the filter.
 */
public record JobListResponse(List<ModerationJob> jobs, JobStats stats) {
}
