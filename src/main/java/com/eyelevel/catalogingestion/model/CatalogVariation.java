package com.eyelevel.catalogingestion.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "catalog_variation")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogVariation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long productId;

    @Column(nullable = false, length = 100)
    private String sku;

    @Column(length = 50)
    private String suffix;

    private String name;

    private long priceAdjustment;

    private boolean available;

    @Column(nullable = false, length = 36)
    private String sourceUploadId;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
