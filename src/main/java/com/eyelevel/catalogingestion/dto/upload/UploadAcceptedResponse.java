package com.eyelevel.catalogingestion.dto.upload;

import com.eyelevel.catalogingestion.model.UploadStatus;

/**
 * Answer to an accepted upload: the session id to poll and the status it was left in.
 */
public record UploadAcceptedResponse(String uploadId, UploadStatus status, String message) {
}
