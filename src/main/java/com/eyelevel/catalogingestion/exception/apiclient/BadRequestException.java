package com.eyelevel.catalogingestion.exception.apiclient;

import java.io.Serial;

/**
 * The request was malformed or failed validation (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = 2205941306512761847L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
