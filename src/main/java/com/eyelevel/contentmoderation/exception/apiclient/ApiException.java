package com.eyelevel.contentmoderation.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for errors returned by, or raised while calling, an external HTTP API.
 *
 * <p>Carries the HTTP status code that caused the failure so callers can decide whether the error is
 * worth retrying. Subclasses exist for the status codes the scoring service is known to return.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 2918430561287710345L;
    private final int statusCode;

    /**
     * @param message    A descriptive message about the exception.
     * @param statusCode The HTTP status code associated with the exception.
     */
    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
