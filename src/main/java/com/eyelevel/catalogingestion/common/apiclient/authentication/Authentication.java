package com.eyelevel.catalogingestion.common.apiclient.authentication;

import java.util.Map;

/**
 * Defines the contract for applying authentication to an API request.
 */
public interface Authentication {

    /**
     * Applies the authentication to the provided authorization map.
     *
     * @param authorization A map containing authorization headers and their values. Implementations
     *                      add or modify entries in this map to apply the authentication scheme.
     */
    void applyAuthentication(Map<String, String> authorization);
}
