package com.eyelevel.contentmoderation.exception;

import java.io.Serial;

/**
 * Thrown from the queue listener when a job's outcome could not be durably recorded. Escaping the
 * listener leaves the message unacknowledged, so the broker redelivers it after the visibility timeout.
 * NOTE: This is an internal exception and should NOT be handled by the GlobalExceptionHandler.
 */
public class MessageProcessingFailedException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1928374650912837465L;

    public MessageProcessingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
