package com.eyelevel.catalogingestion.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "staged_variation")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StagedVariation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36)
    private String uploadId;

    @Column(nullable = false)
    private Long productId;

    @Column(nullable = false, length = 100)
    private String sku;

    @Column(length = 50)
    private String suffix;

    private String name;

    /**
     * Signed delta against the product base price, in minor currency units.
     */
    @Builder.Default
    private long priceAdjustment = 0L;

    @Builder.Default
    private boolean available = true;

    @Builder.Default
    private int extractionConfidence = 75;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
