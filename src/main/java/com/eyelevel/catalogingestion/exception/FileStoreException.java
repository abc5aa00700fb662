package com.eyelevel.catalogingestion.exception;

import java.io.Serial;

/**
 * Thrown when the file store cannot read, write, list or delete an object.
 */
public class FileStoreException extends CatalogIngestionException {
    @Serial
    private static final long serialVersionUID = 3319271650098514467L;

    public FileStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
