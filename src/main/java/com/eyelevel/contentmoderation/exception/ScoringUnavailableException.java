package com.eyelevel.contentmoderation.exception;

import java.io.Serial;

/**
 * Thrown by a {@link com.eyelevel.contentmoderation.service.classifier.ToxicityScorer} when no usable
 * scores could be obtained: a timeout, an error response or a response missing a requested attribute.
 * The classifier downgrades it to a {@code needs_review} decision; it never reaches the worker.
 */
public class ScoringUnavailableException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -6721304898417263508L;

    public ScoringUnavailableException(String message) {
        super(message);
    }

    public ScoringUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
