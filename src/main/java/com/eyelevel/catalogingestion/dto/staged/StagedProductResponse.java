package com.eyelevel.catalogingestion.dto.staged;

import com.eyelevel.catalogingestion.model.ImportStatus;
import com.eyelevel.catalogingestion.model.StagedProduct;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.List;

/**
 * A staged product. Listings leave {@code variations} and {@code images} out; the single-item view
 * fills them in.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StagedProductResponse(
        Long id,
        String uploadId,
        Long familyId,
        String name,
        String modelNumber,
        String description,
        String shortDescription,
        String category,
        Long basePrice,
        BigDecimal width,
        BigDecimal depth,
        BigDecimal height,
        BigDecimal weight,
        BigDecimal volume,
        BigDecimal fabricYardage,
        Boolean inStock,
        boolean requiresReview,
        int extractionConfidence,
        Integer sourcePage,
        ImportStatus importStatus,
        Long version,
        List<StagedVariationResponse> variations,
        List<StagedImageResponse> images) {

    public static StagedProductResponse from(StagedProduct product) {
        return from(product, null, null);
    }

    public static StagedProductResponse from(StagedProduct product, List<StagedVariationResponse> variations,
                                             List<StagedImageResponse> images) {
        return new StagedProductResponse(product.getId(), product.getUploadId(), product.getFamilyId(),
                product.getName(), product.getModelNumber(), product.getDescription(),
                product.getShortDescription(), product.getCategory(), product.getBasePrice(), product.getWidth(),
                product.getDepth(), product.getHeight(), product.getWeight(), product.getVolume(),
                product.getFabricYardage(), product.getInStock(), product.isRequiresReview(),
                product.getExtractionConfidence(), product.getSourcePage(), product.getImportStatus(),
                product.getVersion(), variations, images);
    }
}
