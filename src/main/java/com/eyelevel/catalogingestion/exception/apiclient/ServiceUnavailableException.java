package com.eyelevel.catalogingestion.exception.apiclient;

import java.io.Serial;

/**
 * The remote service could not be reached (HTTP 503).
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = -3907123368116648025L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, 503, cause);
    }
}
