package com.eyelevel.catalogingestion.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Raised on the client side when a polled session ends in {@code failed}. The message is the
 * worker's {@code error_message}, unchanged.
 */
@Getter
public class ParseFailedException extends CatalogIngestionException {
    @Serial
    private static final long serialVersionUID = 4403728818650124781L;

    private final String uploadId;
    private final int pagesProcessed;

    public ParseFailedException(String uploadId, String errorMessage, int pagesProcessed) {
        super(errorMessage);
        this.uploadId = uploadId;
        this.pagesProcessed = pagesProcessed;
    }
}
