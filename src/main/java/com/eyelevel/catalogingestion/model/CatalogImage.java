package com.eyelevel.catalogingestion.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

@Entity
@Table(name = "catalog_image")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogImage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long productId;

    @Column(nullable = false, length = 1024)
    private String path;

    private Integer width;

    private Integer height;

    @Convert(converter = ImageRoleSetConverter.class)
    @Column(length = 50)
    @Builder.Default
    private Set<ImageRole> roles = EnumSet.noneOf(ImageRole.class);

    @Column(nullable = false, length = 36)
    private String sourceUploadId;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
