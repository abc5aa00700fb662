package com.eyelevel.catalogingestion.service.cleanup;

import com.eyelevel.catalogingestion.dto.cleanup.CleanupReport;
import com.eyelevel.catalogingestion.dto.cleanup.ExpiredSweepStats;
import com.eyelevel.catalogingestion.dto.cleanup.OrphanSweepStats;
import com.eyelevel.catalogingestion.exception.FileStoreException;
import com.eyelevel.catalogingestion.model.UploadSession;
import com.eyelevel.catalogingestion.model.UploadStatus;
import com.eyelevel.catalogingestion.repository.CatalogImageRepository;
import com.eyelevel.catalogingestion.repository.StagedFamilyRepository;
import com.eyelevel.catalogingestion.repository.StagedImageRepository;
import com.eyelevel.catalogingestion.repository.StagedProductRepository;
import com.eyelevel.catalogingestion.repository.StagedVariationRepository;
import com.eyelevel.catalogingestion.repository.UploadSessionRepository;
import com.eyelevel.catalogingestion.service.storage.FileStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reclaims staged data and files that are no longer needed.
 * <p>
 * The expired sweep claims each session past {@code expires_at} with a conditional transition to
 * {@code expired}, then deletes its staged rows and files; the session row stays behind as a tombstone.
 * The orphan sweep walks the file store and removes files whose session is gone or expired. The two
 * sweeps report separately and a failure in one never stops the other. Running either twice in a row
 * is harmless: the second run finds nothing left to claim.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CleanupService {

    private static final Set<UploadStatus> EXPIRABLE_STATUSES = EnumSet.complementOf(
            EnumSet.of(UploadStatus.IMPORTED, UploadStatus.EXPIRED));
    private static final int UPLOAD_ID_LENGTH = 36;

    private final UploadSessionRepository uploadSessionRepository;
    private final StagedFamilyRepository stagedFamilyRepository;
    private final StagedProductRepository stagedProductRepository;
    private final StagedVariationRepository stagedVariationRepository;
    private final StagedImageRepository stagedImageRepository;
    private final CatalogImageRepository catalogImageRepository;
    private final FileStore fileStore;
    private CleanupService self;

    @Autowired
    public void setSelf(@Lazy CleanupService self) {
        this.self = self;
    }

    /**
     * Runs the expired sweep and, when asked, the orphan sweep.
     *
     * @param includeOrphaned Whether to scan the file store for orphaned files as well.
     */
    public CleanupReport cleanupExpired(final boolean includeOrphaned) {
        final ExpiredSweepStats expired = sweepExpired();
        final OrphanSweepStats orphaned = includeOrphaned ? sweepOrphans() : null;
        return new CleanupReport(expired, orphaned);
    }

    ExpiredSweepStats sweepExpired() {
        final ExpiredSweepStats stats = new ExpiredSweepStats();
        final List<String> expiredIds;
        try {
            expiredIds = uploadSessionRepository.findExpiredUploadIds(LocalDateTime.now(),
                                                                      EnumSet.of(UploadStatus.IMPORTED,
                                                                                 UploadStatus.EXPIRED));
        } catch (RuntimeException e) {
            log.error("Expired-session sweep could not query expired sessions.", e);
            stats.setErrors(stats.getErrors() + 1);
            return stats;
        }
        if (CollectionUtils.isEmpty(expiredIds)) {
            log.debug("No expired upload sessions found.");
            return stats;
        }

        log.info("Found {} expired upload session(s). Reclaiming.", expiredIds.size());
        for (String uploadId : expiredIds) {
            try {
                final ExpiredSweepStats purged = self.purgeExpiredSession(uploadId);
                if (purged != null) {
                    stats.add(purged);
                }
            } catch (RuntimeException e) {
                log.error("Failed to reclaim expired upload {}.", uploadId, e);
                stats.setErrors(stats.getErrors() + 1);
            }
        }
        log.info("Expired-session sweep finished: {}", stats);
        return stats;
    }

    /**
     * Claims one expired session and deletes its staged rows and files. Does nothing when another actor
     * changed the session's status first.
     *
     * @return what was removed, or {@code null} if the session was not claimed.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ExpiredSweepStats purgeExpiredSession(final String uploadId) {
        if (uploadSessionRepository.transitionStatus(uploadId, UploadStatus.EXPIRED, EXPIRABLE_STATUSES) == 0) {
            log.info("Upload {} was claimed by another actor before it could be expired. Skipping.", uploadId);
            return null;
        }
        final UploadSession session = uploadSessionRepository.findById(uploadId).orElse(null);

        final int variations = stagedVariationRepository.deleteAllByUploadId(uploadId);
        final int images = stagedImageRepository.deleteAllByUploadId(uploadId);
        final int products = stagedProductRepository.deleteAllByUploadId(uploadId);
        final int families = stagedFamilyRepository.deleteAllByUploadId(uploadId);

        int files = 0;
        if (session != null && StringUtils.hasText(session.getFilePath()) && fileStore.delete(session.getFilePath())) {
            files++;
        }
        final String imagePrefix = FileStore.imagePrefix(uploadId);
        if (catalogImageRepository.countReferencingPathPrefix(imagePrefix) == 0) {
            files += fileStore.deletePrefix(imagePrefix);
        }

        final ExpiredSweepStats purged = new ExpiredSweepStats();
        purged.setUploadsDeleted(1);
        purged.setFamiliesDeleted(families);
        purged.setProductsDeleted(products);
        purged.setVariationsDeleted(variations);
        purged.setImagesDeleted(images);
        purged.setFilesDeleted(files);
        log.info("Expired upload {}: removed {} families, {} products, {} variations, {} images, {} files.",
                 uploadId, families, products, variations, images, files);
        return purged;
    }

    OrphanSweepStats sweepOrphans() {
        final OrphanSweepStats stats = new OrphanSweepStats();
        try {
            final Map<String, String> uploadIdByUploadKey = new LinkedHashMap<>();
            for (String key : fileStore.listKeys(FileStore.UPLOADS_PREFIX)) {
                uploadIdByUploadKey.put(key, uploadIdOfUploadKey(key));
            }
            stats.setUploadsScanned(uploadIdByUploadKey.size());

            final Set<String> imageUploadIds = new HashSet<>();
            final List<String> imageKeys = fileStore.listKeys(FileStore.IMAGES_PREFIX);
            for (String key : imageKeys) {
                final String uploadId = uploadIdOfImageKey(key);
                if (uploadId != null) {
                    imageUploadIds.add(uploadId);
                }
            }
            stats.setImagesScanned(imageKeys.size());

            final Set<String> referencedIds = new HashSet<>(imageUploadIds);
            uploadIdByUploadKey.values().stream().filter(id -> id != null).forEach(referencedIds::add);
            final Map<String, UploadStatus> statuses = loadStatuses(referencedIds);

            uploadIdByUploadKey.forEach((key, uploadId) -> {
                if (isOrphaned(uploadId, statuses)) {
                    deleteOrphan(stats, key, () -> fileStore.delete(key) ? 1 : 0);
                }
            });
            for (String uploadId : imageUploadIds) {
                final String prefix = FileStore.imagePrefix(uploadId);
                if (isOrphaned(uploadId, statuses) && catalogImageRepository.countReferencingPathPrefix(prefix) == 0) {
                    deleteOrphan(stats, prefix, () -> fileStore.deletePrefix(prefix));
                }
            }
        } catch (RuntimeException e) {
            log.error("Orphan-file sweep aborted.", e);
            stats.setErrors(stats.getErrors() + 1);
        }
        log.info("Orphan-file sweep finished: {}", stats);
        return stats;
    }

    private Map<String, UploadStatus> loadStatuses(final Set<String> uploadIds) {
        final Map<String, UploadStatus> statuses = new HashMap<>();
        if (uploadIds.isEmpty()) {
            return statuses;
        }
        for (Object[] row : uploadSessionRepository.findStatusesByIds(new ArrayList<>(uploadIds))) {
            statuses.put((String) row[0], (UploadStatus) row[1]);
        }
        return statuses;
    }

    private static boolean isOrphaned(final String uploadId, final Map<String, UploadStatus> statuses) {
        if (uploadId == null) {
            return true;
        }
        final UploadStatus status = statuses.get(uploadId);
        return status == null || status == UploadStatus.EXPIRED;
    }

    private void deleteOrphan(final OrphanSweepStats stats, final String target, final OrphanDeletion deletion) {
        try {
            final int deleted = deletion.run();
            if (deleted > 0) {
                log.info("Deleted orphaned file(s) at '{}'.", target);
            }
            stats.setOrphanedDeleted(stats.getOrphanedDeleted() + deleted);
        } catch (FileStoreException e) {
            log.error("Failed to delete orphaned file(s) at '{}'.", target, e);
            stats.setErrors(stats.getErrors() + 1);
        }
    }

    /**
     * {@code uploads/<uploadId>_<name>} to {@code <uploadId>}, or {@code null} for a key that does not
     * follow that layout.
     */
    static String uploadIdOfUploadKey(final String key) {
        final String name = key.substring(FileStore.UPLOADS_PREFIX.length());
        if (name.length() <= UPLOAD_ID_LENGTH || name.charAt(UPLOAD_ID_LENGTH) != '_') {
            return null;
        }
        return name.substring(0, UPLOAD_ID_LENGTH);
    }

    /**
     * {@code images/<uploadId>/<file>} to {@code <uploadId>}.
     */
    static String uploadIdOfImageKey(final String key) {
        final String rest = key.substring(FileStore.IMAGES_PREFIX.length());
        final int slash = rest.indexOf('/');
        return slash > 0 ? rest.substring(0, slash) : null;
    }

    @FunctionalInterface
    private interface OrphanDeletion {
        int run();
    }
}
