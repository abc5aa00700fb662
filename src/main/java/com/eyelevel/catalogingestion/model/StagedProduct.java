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
 * A product extracted from a catalog page and awaiting review.
 * Monetary values are integer minor currency units. Dimensions are inches, weight pounds,
 * volume cubic feet and fabric yardage yards.
 */
@Entity
@Table(name = "staged_product")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StagedProduct {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36)
    private String uploadId;

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

    @Builder.Default
    private boolean requiresReview = true;

    @Builder.Default
    private int extractionConfidence = 0;

    private Integer sourcePage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ImportStatus importStatus = ImportStatus.PENDING;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
