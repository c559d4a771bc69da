package com.eyelevel.contentmoderation.controller;

import com.eyelevel.contentmoderation.dto.common.ApiResponse;
import com.eyelevel.contentmoderation.dto.report.response.CategoryCount;
import com.eyelevel.contentmoderation.dto.report.response.DailyActivity;
import com.eyelevel.contentmoderation.dto.report.response.WorkerProcessingTime;
import com.eyelevel.contentmoderation.service.report.ReportingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Tag(name = "Reports", description = "Aggregated, read-only views over moderation jobs.")
public class ReportingController {

    private final ReportingService reportingService;

    @Operation(summary = "Processing Times", description = "Average classification time and decision counts per worker.")
    @GetMapping("/processing-times")
    public ResponseEntity<ApiResponse<List<WorkerProcessingTime>>> processingTimes(
            @Parameter(description = "One of day, week, month, year.", example = "week")
            @RequestParam(value = "period", required = false) final String period) {
        return ResponseEntity.ok(ApiResponse.success(reportingService.processingTimes(period),
                                                     "Processing times retrieved successfully.", HttpStatus.OK));
    }

    @Operation(summary = "Daily Activity", description = "Jobs created per day by status, oldest day first.")
    @GetMapping("/activity")
    public ResponseEntity<ApiResponse<List<DailyActivity>>> activity(
            @Parameter(description = "One of day, week, month, year. Defaults to seven days.", example = "month")
            @RequestParam(value = "period", required = false) final String period) {
        return ResponseEntity.ok(ApiResponse.success(reportingService.activity(period),
                                                     "Activity retrieved successfully.", HttpStatus.OK));
    }

    @Operation(summary = "Categories", description = "Job counts per category, largest first.")
    @GetMapping("/categories")
    public ResponseEntity<ApiResponse<List<CategoryCount>>> categories(
            @Parameter(description = "One of day, week, month, year.", example = "year")
            @RequestParam(value = "period", required = false) final String period) {
        return ResponseEntity.ok(ApiResponse.success(reportingService.categories(period),
                                                     "Categories retrieved successfully.", HttpStatus.OK));
    }
}
