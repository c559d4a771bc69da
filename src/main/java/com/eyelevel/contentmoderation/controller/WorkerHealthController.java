package com.eyelevel.contentmoderation.controller;

import com.eyelevel.contentmoderation.config.ModerationProperties;
import com.eyelevel.contentmoderation.dto.liveness.HealthResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * The endpoint probed by the liveness monitor. Answers in a bare body, not the {@code ApiResponse}
 * envelope.
 */
@RestController
@RequiredArgsConstructor
@Tag(name = "System Status")
public class WorkerHealthController {

    private final ModerationProperties properties;

    @Operation(summary = "Worker Health", description = "Returns `ok` with this process's worker id.")
    @GetMapping("/health")
    public HealthResponse health() {
        return HealthResponse.ok(properties.getWorker().getId());
    }
}
