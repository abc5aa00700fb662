package com.eyelevel.catalogingestion.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * A confirmed, customer-facing product family.
 */
@Entity
@Table(name = "catalog_family")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogFamily {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    private String category;

    /**
     * Upload session the row was imported from.
     */
    @Column(nullable = false, length = 36)
    private String sourceUploadId;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
