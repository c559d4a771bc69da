package com.eyelevel.contentmoderation.common.apiclient.authentication.impl;

import com.eyelevel.contentmoderation.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * An implementation of {@link Authentication} that injects a static API key into a request header.
 * The scoring service accepts its key this way, which keeps it out of request URLs and access logs.
 */
@Slf4j
public record APIKeyAuthentication(String headerName, String apiKey) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        if (headers == null) {
            log.error("Header map cannot be null when applying API key authentication.");
            return;
        }
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No API key configured for header '{}'. The request is sent unauthenticated.", headerName);
            return;
        }
        log.debug("Applying API key authentication using header: '{}'", headerName);
        headers.put(headerName, apiKey);
    }

    @Override
    public String toString() {
        return "APIKeyAuthentication[headerName=" + headerName + ", apiKey=****]";
    }
}
