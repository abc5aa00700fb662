package com.eyelevel.catalogingestion.exception.apiclient;

import java.io.Serial;

/**
 * The target exists but may not be changed in its current state (HTTP 403).
 */
public class ForbiddenException extends ApiException {

    @Serial
    private static final long serialVersionUID = -8871940017253350121L;

    public ForbiddenException(String message) {
        super(message, 403);
    }
}
