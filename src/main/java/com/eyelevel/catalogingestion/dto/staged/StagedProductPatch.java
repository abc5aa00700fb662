package com.eyelevel.catalogingestion.dto.staged;

import com.eyelevel.catalogingestion.model.ImportStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Partial update of a staged product. Only non-null fields are applied. When {@code version} is
 * supplied it must match the stored row, otherwise the update is rejected as a conflict.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StagedProductPatch {

    @Size(min = 1, max = 255, message = "must be between 1 and 255 characters")
    private String name;

    @Size(max = 100)
    private String modelNumber;

    private String description;

    @Size(max = 500)
    private String shortDescription;

    private String category;

    private Long familyId;

    @PositiveOrZero
    private Long basePrice;

    @DecimalMin("0.0")
    private BigDecimal width;

    @DecimalMin("0.0")
    private BigDecimal depth;

    @DecimalMin("0.0")
    private BigDecimal height;

    @DecimalMin("0.0")
    private BigDecimal weight;

    @DecimalMin("0.0")
    private BigDecimal volume;

    @DecimalMin("0.0")
    private BigDecimal fabricYardage;

    private Boolean inStock;

    private Boolean requiresReview;

    /**
     * Only {@code pending} and {@code approved} may be set by a reviewer.
     */
    private ImportStatus importStatus;

    private Long version;
}
