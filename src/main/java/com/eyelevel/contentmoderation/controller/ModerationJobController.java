package com.eyelevel.contentmoderation.controller;

import com.eyelevel.contentmoderation.dto.common.ApiResponse;
import com.eyelevel.contentmoderation.dto.job.request.CreateJobRequest;
import com.eyelevel.contentmoderation.dto.job.response.JobListResponse;
import com.eyelevel.contentmoderation.model.ModerationJob;
import com.eyelevel.contentmoderation.service.job.JobIngestionService;
import com.eyelevel.contentmoderation.service.job.JobQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for submitting content and querying moderation jobs.
 * All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
@Validated
public class ModerationJobController implements ModerationJobApi {

    private final JobIngestionService jobIngestionService;
    private final JobQueryService jobQueryService;

    @Override
    @PostMapping
    public ResponseEntity<ApiResponse<ModerationJob>> submitJob(@Valid @RequestBody final CreateJobRequest request) {
        log.info("Received submission from author '{}' in category '{}'.", request.author(), request.category());

        ModerationJob job = jobIngestionService.submit(request);

        return ResponseEntity.status(HttpStatus.CREATED)
                             .body(ApiResponse.success(job, "Content submitted for moderation.", HttpStatus.CREATED));
    }

    @Override
    @GetMapping
    public ResponseEntity<ApiResponse<JobListResponse>> listJobs(
            @RequestParam(value = "status", required = false) final String status,
            @RequestParam(value = "period", required = false) final String period) {

        JobListResponse jobs = jobQueryService.listJobs(status, period);

        return ResponseEntity.ok(ApiResponse.success(jobs, "Jobs retrieved successfully.", HttpStatus.OK));
    }

    @Override
    @GetMapping("/{jobId}")
    public ResponseEntity<ApiResponse<ModerationJob>> getJob(@PathVariable("jobId") final String jobId) {
        return ResponseEntity.ok(ApiResponse.success(jobQueryService.getJob(jobId), "Job retrieved successfully.",
                                                     HttpStatus.OK));
    }
}
