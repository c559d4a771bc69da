package com.eyelevel.contentmoderation.exception.apiclient;

import java.io.Serial;

/**
 * The external API quota was exceeded (HTTP 429).
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = 3310287645023907315L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }
}
