package com.eyelevel.catalogingestion.dto.staged;

import com.eyelevel.catalogingestion.model.StagedVariation;
import com.fasterxml.jackson.annotation.JsonProperty;

public record StagedVariationResponse(
        Long id,
        Long productId,
        String sku,
        String suffix,
        String name,
        long priceAdjustment,
        @JsonProperty("is_available") boolean available,
        int extractionConfidence,
        Long version) {

    public static StagedVariationResponse from(StagedVariation variation) {
        return new StagedVariationResponse(variation.getId(), variation.getProductId(), variation.getSku(),
                variation.getSuffix(), variation.getName(), variation.getPriceAdjustment(),
                variation.isAvailable(), variation.getExtractionConfidence(), variation.getVersion());
    }
}
