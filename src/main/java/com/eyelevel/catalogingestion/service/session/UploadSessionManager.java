package com.eyelevel.catalogingestion.service.session;

import com.eyelevel.catalogingestion.dto.upload.SessionDeletionResult;
import com.eyelevel.catalogingestion.dto.upload.UploadAcceptedResponse;
import com.eyelevel.catalogingestion.dto.upload.UploadSessionResponse;
import com.eyelevel.catalogingestion.exception.FileStoreException;
import com.eyelevel.catalogingestion.exception.apiclient.BadRequestException;
import com.eyelevel.catalogingestion.exception.apiclient.NotFoundException;
import com.eyelevel.catalogingestion.model.UploadSession;
import com.eyelevel.catalogingestion.model.UploadStatus;
import com.eyelevel.catalogingestion.repository.CatalogImageRepository;
import com.eyelevel.catalogingestion.repository.StagedFamilyRepository;
import com.eyelevel.catalogingestion.repository.StagedImageRepository;
import com.eyelevel.catalogingestion.repository.StagedProductRepository;
import com.eyelevel.catalogingestion.repository.StagedVariationRepository;
import com.eyelevel.catalogingestion.repository.UploadSessionRepository;
import com.eyelevel.catalogingestion.service.asynctask.AsyncTaskManager;
import com.eyelevel.catalogingestion.service.parse.CatalogParseWorker;
import com.eyelevel.catalogingestion.service.storage.FileStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for the upload side of the pipeline: accepts catalogs, exposes progress snapshots and
 * removes sessions on request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadSessionManager {

    private final UploadSessionRepository uploadSessionRepository;
    private final StagedFamilyRepository stagedFamilyRepository;
    private final StagedProductRepository stagedProductRepository;
    private final StagedVariationRepository stagedVariationRepository;
    private final StagedImageRepository stagedImageRepository;
    private final CatalogImageRepository catalogImageRepository;
    private final UploadValidationService validationService;
    private final SessionLifecycleManager lifecycleManager;
    private final AsyncTaskManager asyncTaskManager;
    private final CatalogParseWorker parseWorker;
    private final FileStore fileStore;

    /**
     * Validates and stores an uploaded catalog, then hands it to the parse worker.
     * <p>
     * The session is committed in {@code uploading} before the bytes are written so a crash between the
     * two leaves a visible row instead of an untracked file. Parsing is scheduled only after the session
     * has been moved to {@code parsing}.
     *
     * @param workspaceId The workspace the upload belongs to.
     * @param file        The uploaded PDF.
     * @param maxPages    Optional cap on the number of pages to parse.
     *
     * @return The new session id and its status.
     */
    public UploadAcceptedResponse createSession(final String workspaceId, final MultipartFile file,
                                                final Integer maxPages) {
        if (maxPages != null && maxPages < 1) {
            throw new BadRequestException("max_pages must be a positive number.");
        }
        final String safeFilename = validationService.validateCatalogUpload(file);
        final String uploadId = UUID.randomUUID().toString();
        final String fileKey = FileStore.uploadKey(uploadId, safeFilename);

        final UploadSession session = UploadSession.builder()
                                                   .uploadId(uploadId)
                                                   .workspaceId(workspaceId)
                                                   .filename(safeFilename)
                                                   .fileSize(file.getSize())
                                                   .filePath(fileKey)
                                                   .maxPages(maxPages)
                                                   .status(UploadStatus.UPLOADING)
                                                   .currentStep("Uploading")
                                                   .build();
        uploadSessionRepository.save(session);
        log.info("Created upload session {} for '{}' ({} bytes) in workspace '{}'.", uploadId, safeFilename,
                 file.getSize(), workspaceId);

        try (InputStream in = file.getInputStream()) {
            fileStore.store(fileKey, in, file.getSize());
        } catch (IOException | FileStoreException e) {
            log.error("Failed to store uploaded file for session {}. Removing the session.", uploadId, e);
            uploadSessionRepository.deleteById(uploadId);
            if (e instanceof FileStoreException fileStoreException) {
                throw fileStoreException;
            }
            throw new FileStoreException("Could not read the uploaded file.", e);
        }

        lifecycleManager.markParsing(uploadId);
        asyncTaskManager.runAfterCommit(uploadId, () -> parseWorker.parse(uploadId),
                                        () -> lifecycleManager.failed(uploadId,
                                                                      "Parse worker is saturated; retry the upload later."));

        return new UploadAcceptedResponse(uploadId, UploadStatus.PARSING,
                                          "Upload accepted. Parsing started in the background.");
    }

    @Transactional(readOnly = true)
    public UploadSessionResponse getStatus(final String uploadId) {
        return uploadSessionRepository.findById(uploadId)
                                      .map(UploadSessionResponse::from)
                                      .orElseThrow(() -> new NotFoundException(
                                              "Upload session not found with ID: " + uploadId));
    }

    /**
     * Most recent sessions of a workspace, newest first.
     */
    @Transactional(readOnly = true)
    public List<UploadSessionResponse> listRecent(final String workspaceId, final int limit) {
        return uploadSessionRepository.findByWorkspaceIdOrderByCreatedAtDesc(workspaceId, PageRequest.of(0, limit))
                                      .stream()
                                      .map(UploadSessionResponse::from)
                                      .toList();
    }

    /**
     * Removes a session with all of its staged rows and files, whatever its status. The session row is
     * locked first so a concurrent import or cleanup either finishes before the delete or sees no row.
     * File removal is best effort: failures are logged and left to the orphan sweep.
     */
    @Transactional
    public SessionDeletionResult deleteSession(final String uploadId) {
        final UploadSession session = uploadSessionRepository.findByIdForUpdate(uploadId)
                                                             .orElseThrow(() -> new NotFoundException(
                                                                     "Upload session not found with ID: " + uploadId));
        log.warn("Deleting upload session {} in status {}.", uploadId, session.getStatus());

        final int variations = stagedVariationRepository.deleteAllByUploadId(uploadId);
        final int images = stagedImageRepository.deleteAllByUploadId(uploadId);
        final int products = stagedProductRepository.deleteAllByUploadId(uploadId);
        final int families = stagedFamilyRepository.deleteAllByUploadId(uploadId);

        int files = 0;
        if (StringUtils.hasText(session.getFilePath())) {
            files += deleteFileQuietly(uploadId, session.getFilePath());
        }
        final String imagePrefix = FileStore.imagePrefix(uploadId);
        if (catalogImageRepository.countReferencingPathPrefix(imagePrefix) == 0) {
            files += deletePrefixQuietly(uploadId, imagePrefix);
        } else {
            log.info("Keeping images of upload {}: referenced by the production catalog.", uploadId);
        }

        uploadSessionRepository.delete(session);
        log.info("Deleted upload session {}: {} families, {} products, {} variations, {} images, {} files.",
                 uploadId, families, products, variations, images, files);
        return new SessionDeletionResult(uploadId, families, products, variations, images, files);
    }

    private int deleteFileQuietly(final String uploadId, final String key) {
        try {
            return fileStore.delete(key) ? 1 : 0;
        } catch (FileStoreException e) {
            log.error("Failed to delete file '{}' of upload {}; the orphan sweep will retry.", key, uploadId, e);
            return 0;
        }
    }

    private int deletePrefixQuietly(final String uploadId, final String prefix) {
        try {
            return fileStore.deletePrefix(prefix);
        } catch (FileStoreException e) {
            log.error("Failed to delete files under '{}' of upload {}; the orphan sweep will retry.", prefix,
                      uploadId, e);
            return 0;
        }
    }
}
