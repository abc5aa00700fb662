package com.eyelevel.catalogingestion.exception;

import com.eyelevel.catalogingestion.exception.apiclient.ForbiddenException;

import java.io.Serial;

/**
 * A staged row was about to be changed while its session no longer accepts review edits.
 */
public class StagedDataFrozenException extends ForbiddenException {
    @Serial
    private static final long serialVersionUID = -5170232984216674592L;

    public StagedDataFrozenException(String message) {
        super(message);
    }
}
