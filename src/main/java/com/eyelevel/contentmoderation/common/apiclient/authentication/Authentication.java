package com.eyelevel.contentmoderation.common.apiclient.authentication;

import java.util.Map;

/**
 * Defines the contract for applying authentication to an API request.
 */
public interface Authentication {

    /**
     * Applies the authentication to the provided header map.
     *
     * @param headers The mutable header map of the outgoing request.
     */
    void applyAuthentication(Map<String, String> headers);
}
