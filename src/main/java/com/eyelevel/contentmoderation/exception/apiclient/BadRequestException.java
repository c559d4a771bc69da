package com.eyelevel.contentmoderation.exception.apiclient;

import java.io.Serial;

/**
 * The external API rejected the request as malformed (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = -5520931187460235571L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
