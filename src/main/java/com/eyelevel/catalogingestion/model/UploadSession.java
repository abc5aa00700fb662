package com.eyelevel.catalogingestion.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * One uploaded catalog PDF and its parse progress. Owns every staged row carrying its {@code uploadId}.
 */
@Entity
@Table(name = "upload_session")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadSession {

    @Id
    @Column(length = 36)
    private String uploadId;

    @Column(nullable = false, length = 100)
    private String workspaceId;

    @Column(nullable = false)
    private String filename;

    private Long fileSize;

    /**
     * Key of the stored PDF inside the file store.
     */
    @Column(length = 1024)
    private String filePath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UploadStatus status;

    /**
     * Upper bound on pages to parse, {@code null} for the whole document.
     */
    private Integer maxPages;

    @Builder.Default
    private int totalPages = 0;

    @Builder.Default
    private int pagesProcessed = 0;

    private String currentStep;

    @Builder.Default
    private int familiesFound = 0;

    @Builder.Default
    private int productsFound = 0;

    @Builder.Default
    private int variationsFound = 0;

    @Builder.Default
    private int imagesExtracted = 0;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private LocalDateTime importedAt;

    private LocalDateTime expiresAt;
}
