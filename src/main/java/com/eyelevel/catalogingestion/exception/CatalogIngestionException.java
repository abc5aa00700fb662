package com.eyelevel.catalogingestion.exception;

import java.io.Serial;

/**
 * Base exception for failures inside the ingestion pipeline that are not tied to an HTTP status.
 */
public class CatalogIngestionException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -2516978406338128847L;

    public CatalogIngestionException(String message) {
        super(message);
    }

    public CatalogIngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
