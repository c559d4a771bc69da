package com.eyelevel.contentmoderation.exception;

import java.io.Serial;

/**
 * Thrown when a moderation job is looked up by an id the store does not know.
 */
public class JobNotFoundException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 5027718236655179420L;

    public JobNotFoundException(String jobId) {
        super("Moderation job not found with ID: " + jobId);
    }
}
