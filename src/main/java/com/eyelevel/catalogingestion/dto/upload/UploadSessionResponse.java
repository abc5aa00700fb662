package com.eyelevel.catalogingestion.dto.upload;

import com.eyelevel.catalogingestion.model.UploadSession;
import com.eyelevel.catalogingestion.model.UploadStatus;

import java.time.LocalDateTime;

/**
 * Read-only snapshot of an {@link UploadSession}, returned by the status endpoint the client polls.
 */
public record UploadSessionResponse(
        String uploadId,
        String filename,
        Long fileSize,
        UploadStatus status,
        Integer maxPages,
        int totalPages,
        int pagesProcessed,
        String currentStep,
        int familiesFound,
        int productsFound,
        int variationsFound,
        int imagesExtracted,
        String errorMessage,
        LocalDateTime createdAt,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        LocalDateTime importedAt,
        LocalDateTime expiresAt) {

    public static UploadSessionResponse from(UploadSession session) {
        return new UploadSessionResponse(session.getUploadId(), session.getFilename(), session.getFileSize(),
                session.getStatus(), session.getMaxPages(), session.getTotalPages(), session.getPagesProcessed(),
                session.getCurrentStep(), session.getFamiliesFound(), session.getProductsFound(),
                session.getVariationsFound(), session.getImagesExtracted(), session.getErrorMessage(),
                session.getCreatedAt(), session.getStartedAt(), session.getCompletedAt(), session.getImportedAt(),
                session.getExpiresAt());
    }
}
