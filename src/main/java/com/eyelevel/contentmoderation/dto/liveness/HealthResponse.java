package com.eyelevel.contentmoderation.dto.liveness;

/**
 * Body of the worker health endpoint, e.g. {@code {"status":"ok","workerId":"worker-1"}}.
 */
public record HealthResponse(String status, String workerId) {

    public static HealthResponse ok(final String workerId) {
        return new HealthResponse("ok", workerId);
    }
}
