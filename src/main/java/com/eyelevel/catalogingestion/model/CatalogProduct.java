package com.eyelevel.catalogingestion.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A confirmed, customer-facing product. Mirrors {@link StagedProduct} without the review metadata.
 */
@Entity
@Table(name = "catalog_product")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogProduct {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long familyId;

    @Column(nullable = false)
    private String name;

    @Column(length = 100)
    private String modelNumber;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(length = 500)
    private String shortDescription;

    private String category;

    private Long basePrice;

    @Column(precision = 10, scale = 2)
    private BigDecimal width;

    @Column(precision = 10, scale = 2)
    private BigDecimal depth;

    @Column(precision = 10, scale = 2)
    private BigDecimal height;

    @Column(precision = 10, scale = 2)
    private BigDecimal weight;

    @Column(precision = 10, scale = 2)
    private BigDecimal volume;

    @Column(precision = 10, scale = 2)
    private BigDecimal fabricYardage;

    private Boolean inStock;

    @Column(nullable = false, length = 36)
    private String sourceUploadId;

    private Long sourceStagedProductId;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
