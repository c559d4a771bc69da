package com.eyelevel.contentmoderation.exception.apiclient;

import java.io.Serial;

/**
 * The external API rejected the configured credentials (HTTP 401 or 403).
 */
public class UnauthorizedException extends ApiException {

    @Serial
    private static final long serialVersionUID = 7736183260912850341L;

    public UnauthorizedException(String message, int statusCode) {
        super(message, statusCode);
    }
}
