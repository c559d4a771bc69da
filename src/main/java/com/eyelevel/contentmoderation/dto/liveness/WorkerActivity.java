package com.eyelevel.contentmoderation.dto.liveness;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Whether a worker currently owns a job in {@code processing}, as seen by the job store.
 */
public enum WorkerActivity {
    BUSY,
    IDLE,
    /**
     * The store could not be queried for this worker.
     */
    UNKNOWN;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
