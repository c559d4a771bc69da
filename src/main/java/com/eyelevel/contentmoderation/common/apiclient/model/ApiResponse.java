package com.eyelevel.contentmoderation.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Represents a successful (2xx) response from an external API call. The body is kept as raw bytes
 * and parsed by the concrete client.
 */
@Builder
@Getter
public class ApiResponse {

    @Nullable
    private final byte[] data;

    @Nullable
    private final MediaType contentType;

    private final int statusCode;

    private final Instant timestamp;
}
