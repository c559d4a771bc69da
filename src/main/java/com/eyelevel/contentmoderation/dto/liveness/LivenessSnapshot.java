package com.eyelevel.contentmoderation.dto.liveness;

import com.eyelevel.contentmoderation.service.queue.ConnectionState;

import java.time.Instant;
import java.util.List;

/**
 * A point-in-time view of the worker fleet and the work queue connection. Never persisted.
 */
public record LivenessSnapshot(Instant checkedAt, ConnectionState queueState, List<WorkerStatus> workers) {

    public long reachableWorkers() {
        return workers.stream().filter(WorkerStatus::reachable).count();
    }
}
