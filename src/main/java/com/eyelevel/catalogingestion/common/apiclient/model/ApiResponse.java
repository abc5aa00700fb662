package com.eyelevel.catalogingestion.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Raw response of a successful API call: body bytes plus metadata. Error responses never get this far;
 * they are turned into an {@code ApiException}.
 */
@Builder
@Getter
public class ApiResponse {

    private final byte[] data;

    @Nullable
    private final MediaType acceptType;

    @Nullable
    private final HttpHeaders headers;

    private final int statusCode;

    private final Instant timestamp;
}
