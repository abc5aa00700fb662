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
@Table(name = "staged_image")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StagedImage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36)
    private String uploadId;

    @Column(nullable = false)
    private Long productId;

    /**
     * File store key or absolute URL of the image.
     */
    @Column(nullable = false, length = 1024)
    private String path;

    private Integer width;

    private Integer height;

    private Integer sourcePage;

    @Convert(converter = ImageRoleSetConverter.class)
    @Column(length = 50)
    @Builder.Default
    private Set<ImageRole> roles = EnumSet.noneOf(ImageRole.class);

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
