package com.eyelevel.contentmoderation.exception;

import java.io.Serial;

/**
 * Thrown when a work item cannot be handed to the work queue, either because the queue connection
 * is not ready or because the broker refused the send. Callers must not treat the item as enqueued.
 */
public class QueueUnavailableException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 8170339452196604371L;

    public QueueUnavailableException(String message) {
        super(message);
    }

    public QueueUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
