package com.eyelevel.contentmoderation.exception;

import java.io.Serial;

/**
 * Thrown when a submission or query is rejected before any state is created, e.g. a job without a
 * title, content or author, or an unknown status filter.
 */
public class JobValidationException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -2284915301655703297L;

    public JobValidationException(String message) {
        super(message);
    }
}
