package com.eyelevel.catalogingestion.exception.apiclient;

import java.io.Serial;

/**
 * The remote service did not answer in time (HTTP 504).
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = 8840152970643317420L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }

    public GatewayTimeoutException(String message, Throwable cause) {
        super(message, 504, cause);
    }
}
