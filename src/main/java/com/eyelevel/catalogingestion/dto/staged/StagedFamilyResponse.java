package com.eyelevel.catalogingestion.dto.staged;

import com.eyelevel.catalogingestion.model.ImportStatus;
import com.eyelevel.catalogingestion.model.StagedFamily;

public record StagedFamilyResponse(
        Long id,
        String uploadId,
        String name,
        String description,
        String category,
        Integer sourcePage,
        int extractionConfidence,
        boolean requiresReview,
        ImportStatus importStatus) {

    public static StagedFamilyResponse from(StagedFamily family) {
        return new StagedFamilyResponse(family.getId(), family.getUploadId(), family.getName(),
                family.getDescription(), family.getCategory(), family.getSourcePage(),
                family.getExtractionConfidence(), family.isRequiresReview(), family.getImportStatus());
    }
}
