package com.eyelevel.contentmoderation.exception.apiclient;

import java.io.Serial;

/**
 * The external API did not answer within the configured timeout (HTTP 504).
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = 6092237416853398271L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }
}
