package com.eyelevel.catalogingestion.client;

import com.eyelevel.catalogingestion.dto.upload.UploadSessionResponse;
import com.eyelevel.catalogingestion.exception.ParseFailedException;

/**
 * Callbacks of {@link CatalogReviewOrchestrator#startUpload}. Exactly one of {@link #onReviewReady},
 * {@link #onFailed} and {@link #onError} ends an upload, unless it is cancelled first.
 */
public interface ReviewListener {

    default void onProgress(UploadSessionResponse status) {
    }

    void onReviewReady(ReviewState review);

    /**
     * The parse job failed; the message is the session's {@code error_message}.
     */
    void onFailed(ParseFailedException failure);

    /**
     * Transport failure, a session deleted out of band, or any other error that ended the upload.
     */
    void onError(RuntimeException error);
}
