package com.eyelevel.contentmoderation.controller;

import com.eyelevel.contentmoderation.dto.common.ApiResponse;
import com.eyelevel.contentmoderation.dto.job.request.CreateJobRequest;
import com.eyelevel.contentmoderation.dto.job.response.JobListResponse;
import com.eyelevel.contentmoderation.model.ModerationJob;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

@Tag(name = "Moderation Jobs", description = "Submit content for moderation and query the resulting jobs.")
public interface ModerationJobApi {

    @Operation(summary = "Submit Content",
            description = "Persists a new moderation job and hands it to the worker pool. The job is returned as `pending`; the decision is recorded asynchronously.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Job created.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Content submitted for moderation.",
                                        "response": {
                                            "id": "3f1c2a9e-6b7d-4e51-9a0c-2d8f7e4b1c55",
                                            "title": "Weekend plans",
                                            "content": "this is great",
                                            "author": "alice",
                                            "category": "general",
                                            "serverTag": "server1",
                                            "status": "pending",
                                            "createdAt": "2024-05-04T10:15:30Z"
                                        },
                                        "showMessage": false,
                                        "statusCode": 201
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - title, content or author is missing or blank.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ModerationJob>> submitJob(@Valid @RequestBody CreateJobRequest request);

    @Operation(summary = "List Jobs",
            description = "Lists jobs newest first, filtered by status and creation period, together with whole-store counts by status.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Jobs retrieved.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - unknown status or period.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobListResponse>> listJobs(
            @Parameter(description = "`all` or one of pending, processing, approved, rejected, needs_review.", example = "needs_review")
            @RequestParam(value = "status", required = false) String status,
            @Parameter(description = "One of day, week, month, year. Omit for all time.", example = "week")
            @RequestParam(value = "period", required = false) String period);

    @Operation(summary = "Get Job", description = "Fetches a single moderation job by its id.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - no job with that id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ModerationJob>> getJob(
            @Parameter(description = "The job id.", required = true) @PathVariable("jobId") String jobId);
}
