package com.eyelevel.catalogingestion.exception;

import com.eyelevel.catalogingestion.exception.apiclient.BadRequestException;

import java.io.Serial;

/**
 * The uploaded payload is not a PDF document. No upload session is created.
 */
public class InvalidFormatException extends BadRequestException {
    @Serial
    private static final long serialVersionUID = -6803165270183904412L;

    public InvalidFormatException(String message) {
        super(message);
    }
}
