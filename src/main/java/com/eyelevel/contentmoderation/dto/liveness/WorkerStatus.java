package com.eyelevel.contentmoderation.dto.liveness;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param workerId  The configured worker id.
 * @param reachable {@code true} if the worker's health endpoint answered with a 2xx within the probe timeout.
 * @param activity  Busy or idle according to the job store.
 * @param error     Why the probe failed; null when reachable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerStatus(String workerId, boolean reachable, WorkerActivity activity, String error) {
}
