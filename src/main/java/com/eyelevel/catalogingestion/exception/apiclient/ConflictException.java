package com.eyelevel.catalogingestion.exception.apiclient;

import java.io.Serial;

/**
 * The request collides with the current state of the resource (HTTP 409).
 */
public class ConflictException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1427761935846029107L;

    public ConflictException(String message) {
        super(message, 409);
    }
}
