package com.eyelevel.contentmoderation.exception.json;

import java.io.Serial;

/**
 * Raised by the JSON helpers for an unreadable work item, scoring response or backup payload.
 * The web layer maps it to 400; the queue listener drops the message.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -3390461822178046113L;

    public JsonParsingException(String message) {
        super(message);
    }

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
