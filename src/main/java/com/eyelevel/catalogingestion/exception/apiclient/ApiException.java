package com.eyelevel.catalogingestion.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Root of the HTTP-aware exception hierarchy. Carries the status code that the REST layer answers
 * with, and that the API client maps error responses back into.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 6120348812290583511L;
    private final int statusCode;

    /**
     * @param message    Message shown to the caller.
     * @param statusCode HTTP status code associated with the failure.
     */
    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
