package com.eyelevel.catalogingestion.exception.apiclient;

import java.io.Serial;

/**
 * The referenced upload session or staged row does not exist (HTTP 404).
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = 5583301729040118836L;

    public NotFoundException(String message) {
        super(message, 404);
    }
}
