package com.eyelevel.catalogingestion.exception.apiclient;

import java.io.Serial;

/**
 * An unexpected server-side failure (HTTP 500).
 */
public class InternalServerException extends ApiException {

    @Serial
    private static final long serialVersionUID = 7314485920015762349L;

    public InternalServerException(String message) {
        super(message, 500);
    }
}
