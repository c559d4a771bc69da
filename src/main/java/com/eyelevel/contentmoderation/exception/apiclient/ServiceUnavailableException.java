package com.eyelevel.contentmoderation.exception.apiclient;

import java.io.Serial;

/**
 * The external API could not be reached or reported itself unavailable (HTTP 503).
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1863405527139045880L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }
}
