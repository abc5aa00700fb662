package com.eyelevel.catalogingestion.exception.json;

import java.io.Serial;

/**
 * Thrown when a JSON payload cannot be read into the requested type.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2067716035482519873L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
