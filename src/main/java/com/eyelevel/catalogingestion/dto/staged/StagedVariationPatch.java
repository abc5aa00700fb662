package com.eyelevel.catalogingestion.dto.staged;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StagedVariationPatch {

    @Size(min = 1, max = 100)
    private String sku;

    @Size(max = 50)
    private String suffix;

    private String name;

    private Long priceAdjustment;

    @JsonProperty("is_available")
    private Boolean available;

    private Long version;
}
