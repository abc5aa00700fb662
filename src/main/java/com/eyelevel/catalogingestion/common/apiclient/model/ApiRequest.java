package com.eyelevel.catalogingestion.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * A request to the ingestion REST API: method, path template, optional query parameters, path
 * variables, headers and body.
 */
@Builder
@Data
public class ApiRequest {

    private final HttpMethod method;

    /**
     * Path template relative to the client's base URL, e.g. {@code /uploads/{uploadId}/status}.
     */
    private final String path;

    /**
     * Query parameters; entries with a {@code null} value are left out.
     */
    @Nullable
    private final Map<String, Object> queryParams;

    @Nullable
    private final Map<String, Object> pathVariables;

    private final Map<String, String> headers = new HashMap<>();

    /**
     * A pre-serialized JSON string, or a multipart {@code MultiValueMap}.
     */
    @Nullable
    private final Object body;

    @Nullable
    private final MediaType acceptMediaType;

    @Nullable
    private final MediaType contentType;
}
