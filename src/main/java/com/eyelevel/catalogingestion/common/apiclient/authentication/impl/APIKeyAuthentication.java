package com.eyelevel.catalogingestion.common.apiclient.authentication.impl;

import com.eyelevel.catalogingestion.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Sends a static API key on every request to the ingestion service. A blank key disables the header,
 * which is how the client talks to a service running without an auth gateway in front of it.
 */
@Slf4j
public record APIKeyAuthentication(String headerName, String apiKey) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> authorization) {
        if (authorization == null) {
            log.error("Authorization map cannot be null when applying API key authentication.");
            return;
        }
        if (!StringUtils.hasText(apiKey)) {
            log.trace("No API key configured; sending request without header '{}'.", headerName);
            return;
        }

        log.debug("Applying API key authentication using header: '{}'", headerName);
        try {
            authorization.put(headerName, apiKey);
        } catch (UnsupportedOperationException e) {
            log.error("Cannot apply API key authentication. The provided authorization map is immutable.", e);
            throw e;
        }
    }
}
