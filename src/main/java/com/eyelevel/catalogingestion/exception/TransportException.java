package com.eyelevel.catalogingestion.exception;

import java.io.Serial;

/**
 * A network failure or timeout while talking to the ingestion API.
 */
public class TransportException extends CatalogIngestionException {
    @Serial
    private static final long serialVersionUID = -7710823350926684193L;

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
