package com.eyelevel.contentmoderation.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Represents a request to an external API: method, path relative to the client's base URL, optional
 * query parameters, headers and body.
 */
@Builder
@Data
public class ApiRequest {

    private final HttpMethod method;

    private final String path;

    @Nullable
    private final Map<String, Object> queryParams;

    /**
     * Mutable so that the {@link com.eyelevel.contentmoderation.common.apiclient.authentication.Authentication}
     * can add its header before the request is sent.
     */
    private final Map<String, String> headers = new HashMap<>();

    @Nullable
    private final Object body;

    @Nullable
    private final MediaType acceptMediaType;

    @Nullable
    private final MediaType contentType;
}
