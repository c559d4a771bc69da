package com.eyelevel.contentmoderation.controller;

import com.eyelevel.contentmoderation.dto.common.ApiResponse;
import com.eyelevel.contentmoderation.dto.liveness.LivenessSnapshot;
import com.eyelevel.contentmoderation.service.liveness.LivenessMonitor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/status")
@RequiredArgsConstructor
@Tag(name = "System Status", description = "Work queue connectivity and worker liveness.")
public class SystemStatusController {

    private final LivenessMonitor livenessMonitor;

    @Operation(summary = "System Status",
            description = "Probes every configured worker and reports whether it is reachable and busy, plus the work queue connection state.")
    @GetMapping
    public ResponseEntity<ApiResponse<LivenessSnapshot>> status() {
        return ResponseEntity.ok(ApiResponse.success(livenessMonitor.snapshot(), "System status retrieved.",
                                                     HttpStatus.OK));
    }
}
