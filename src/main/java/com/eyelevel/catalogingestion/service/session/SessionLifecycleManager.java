package com.eyelevel.catalogingestion.service.session;

import com.eyelevel.catalogingestion.config.CatalogIngestionConfig;
import com.eyelevel.catalogingestion.model.UploadSession;
import com.eyelevel.catalogingestion.model.UploadStatus;
import com.eyelevel.catalogingestion.repository.UploadSessionRepository;
import com.eyelevel.catalogingestion.service.parse.ParseCounts;
import com.eyelevel.catalogingestion.service.parse.ParseProgressReporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;

/**
 * Owns every status and progress change of an {@link UploadSession} while it is being parsed.
 * Each method runs in its own transaction so progress becomes visible to pollers immediately,
 * independent of whatever the parse job is doing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionLifecycleManager implements ParseProgressReporter {

    private final UploadSessionRepository uploadSessionRepository;
    private final CatalogIngestionConfig config;

    /**
     * Conditionally moves a session from one of {@code expected} to {@code target}. Concurrent actors
     * racing for the same session are serialized by the database: exactly one of them sees {@code true}.
     *
     * @return {@code true} if this call performed the transition.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean transition(final String uploadId, final UploadStatus target,
                              final Collection<UploadStatus> expected) {
        final int rowsUpdated = uploadSessionRepository.transitionStatus(uploadId, target, expected);
        if (rowsUpdated == 0) {
            log.debug("Transition of upload {} to {} skipped: status not in {}.", uploadId, target, expected);
            return false;
        }
        log.info("Upload {} transitioned to {}.", uploadId, target);
        return true;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean started(final String uploadId, final int totalPages) {
        final Optional<UploadSession> session = findParsing(uploadId);
        if (session.isEmpty()) {
            return false;
        }
        final UploadSession upload = session.get();
        upload.setTotalPages(Math.max(upload.getTotalPages(), totalPages));
        upload.setStartedAt(LocalDateTime.now());
        upload.setCurrentStep("Analyzing PDF structure");
        uploadSessionRepository.save(upload);
        log.info("[{}] Parsing started: {} page(s) to process.", uploadId, totalPages);
        return true;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean pageProcessed(final String uploadId, final int pagesProcessed, final ParseCounts counts,
                                 final String currentStep) {
        final Optional<UploadSession> session = findParsing(uploadId);
        if (session.isEmpty()) {
            return false;
        }
        final UploadSession upload = session.get();
        if (pagesProcessed < upload.getPagesProcessed()) {
            log.warn("[{}] Ignoring regressing progress report: {} < {} pages.", uploadId, pagesProcessed,
                     upload.getPagesProcessed());
            return true;
        }
        upload.setPagesProcessed(pagesProcessed);
        applyCounts(upload, counts);
        upload.setCurrentStep(currentStep);
        uploadSessionRepository.save(upload);
        return true;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean completed(final String uploadId, final ParseCounts counts) {
        final Optional<UploadSession> session = findParsing(uploadId);
        if (session.isEmpty()) {
            return false;
        }
        final UploadSession upload = session.get();
        final LocalDateTime now = LocalDateTime.now();
        applyCounts(upload, counts);
        upload.setStatus(UploadStatus.COMPLETED);
        upload.setCurrentStep("Completed");
        upload.setErrorMessage(null);
        upload.setCompletedAt(now);
        upload.setExpiresAt(now.plusHours(config.getRetentionHours()));
        uploadSessionRepository.save(upload);
        log.info("[{}] Parsing completed: {} families, {} products, {} variations, {} images.", uploadId,
                 upload.getFamiliesFound(), upload.getProductsFound(), upload.getVariationsFound(),
                 upload.getImagesExtracted());
        return true;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean failed(final String uploadId, final String errorMessage) {
        final UploadSession upload = uploadSessionRepository.findById(uploadId).orElse(null);
        if (upload == null) {
            log.warn("[{}] Cannot record failure: upload session no longer exists.", uploadId);
            return false;
        }
        if (!UploadStatus.IN_FLIGHT.contains(upload.getStatus())) {
            log.warn("[{}] Cannot record failure: upload is already {}.", uploadId, upload.getStatus());
            return false;
        }
        final LocalDateTime now = LocalDateTime.now();
        upload.setStatus(UploadStatus.FAILED);
        upload.setErrorMessage(StringUtils.hasText(errorMessage) ? errorMessage : "Parsing failed for an unknown reason.");
        upload.setCurrentStep("Failed");
        upload.setCompletedAt(now);
        upload.setExpiresAt(now.plusHours(config.getRetentionHours()));
        uploadSessionRepository.save(upload);
        log.error("[{}] Parsing failed after {} page(s): {}", uploadId, upload.getPagesProcessed(),
                  upload.getErrorMessage());
        return true;
    }

    /**
     * Moves a freshly stored upload from {@code uploading} to {@code parsing}.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markParsing(final String uploadId) {
        return transition(uploadId, UploadStatus.PARSING, EnumSet.of(UploadStatus.UPLOADING));
    }

    private Optional<UploadSession> findParsing(final String uploadId) {
        final Optional<UploadSession> session = uploadSessionRepository.findById(uploadId);
        if (session.isEmpty()) {
            log.warn("[{}] Dropping progress report: upload session no longer exists.", uploadId);
            return Optional.empty();
        }
        if (session.get().getStatus() != UploadStatus.PARSING) {
            log.warn("[{}] Dropping progress report: upload is {} rather than parsing.", uploadId,
                     session.get().getStatus());
            return Optional.empty();
        }
        return session;
    }

    private static void applyCounts(final UploadSession upload, final ParseCounts counts) {
        upload.setFamiliesFound(Math.max(upload.getFamiliesFound(), counts.families()));
        upload.setProductsFound(Math.max(upload.getProductsFound(), counts.products()));
        upload.setVariationsFound(Math.max(upload.getVariationsFound(), counts.variations()));
        upload.setImagesExtracted(Math.max(upload.getImagesExtracted(), counts.images()));
    }
}
