package com.eyelevel.catalogingestion.exception;

import com.eyelevel.catalogingestion.exception.apiclient.ConflictException;
import com.eyelevel.catalogingestion.model.UploadStatus;
import lombok.Getter;

import java.io.Serial;

/**
 * Import was requested for a session that is not in {@link UploadStatus#COMPLETED}.
 */
@Getter
public class AlreadyImportedException extends ConflictException {
    @Serial
    private static final long serialVersionUID = 1844075529134468790L;

    private final transient UploadStatus currentStatus;

    public AlreadyImportedException(String uploadId, UploadStatus currentStatus) {
        super(String.format("Upload %s cannot be imported from status '%s'.", uploadId, currentStatus.getValue()));
        this.currentStatus = currentStatus;
    }
}
