package com.eyelevel.catalogingestion.service.staging;

import com.eyelevel.catalogingestion.common.paging.OffsetPageRequest;
import com.eyelevel.catalogingestion.config.CatalogIngestionConfig;
import com.eyelevel.catalogingestion.dto.staged.PageResult;
import com.eyelevel.catalogingestion.dto.staged.StagedDeletionResult;
import com.eyelevel.catalogingestion.dto.staged.StagedFamilyResponse;
import com.eyelevel.catalogingestion.dto.staged.StagedImageResponse;
import com.eyelevel.catalogingestion.dto.staged.StagedProductPatch;
import com.eyelevel.catalogingestion.dto.staged.StagedProductResponse;
import com.eyelevel.catalogingestion.dto.staged.StagedVariationPatch;
import com.eyelevel.catalogingestion.dto.staged.StagedVariationResponse;
import com.eyelevel.catalogingestion.exception.FileStoreException;
import com.eyelevel.catalogingestion.exception.StagedDataFrozenException;
import com.eyelevel.catalogingestion.exception.apiclient.BadRequestException;
import com.eyelevel.catalogingestion.exception.apiclient.ConflictException;
import com.eyelevel.catalogingestion.exception.apiclient.NotFoundException;
import com.eyelevel.catalogingestion.model.ImportStatus;
import com.eyelevel.catalogingestion.model.StagedFamily;
import com.eyelevel.catalogingestion.model.StagedProduct;
import com.eyelevel.catalogingestion.model.StagedVariation;
import com.eyelevel.catalogingestion.model.UploadSession;
import com.eyelevel.catalogingestion.model.UploadStatus;
import com.eyelevel.catalogingestion.repository.StagedFamilyRepository;
import com.eyelevel.catalogingestion.repository.StagedImageRepository;
import com.eyelevel.catalogingestion.repository.StagedProductRepository;
import com.eyelevel.catalogingestion.repository.StagedVariationRepository;
import com.eyelevel.catalogingestion.repository.UploadSessionRepository;
import com.eyelevel.catalogingestion.service.storage.FileStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Review-time access to staged families, products, variations and images.
 * <p>
 * Listings are paged by offset over the primary key, so a page boundary never moves when other rows
 * are edited. Mutations are only accepted while the owning session is {@code completed} or
 * {@code failed}: a session still being parsed or already imported or expired rejects them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StagedDataService {

    private static final Set<ImportStatus> REVIEWER_IMPORT_STATUSES = EnumSet.of(ImportStatus.PENDING,
                                                                                 ImportStatus.APPROVED);

    private final UploadSessionRepository uploadSessionRepository;
    private final StagedFamilyRepository stagedFamilyRepository;
    private final StagedProductRepository stagedProductRepository;
    private final StagedVariationRepository stagedVariationRepository;
    private final StagedImageRepository stagedImageRepository;
    private final FileStore fileStore;
    private final CatalogIngestionConfig config;

    /**
     * Lists staged families of a session.
     *
     * @param workspaceId Workspace used to find the latest session when {@code uploadId} is {@code null}.
     * @param uploadId    Explicit session, or {@code null} for the workspace's latest completed session.
     * @param offset      Row offset, zero or more.
     * @param limit       Page size, {@code null} for the configured default.
     */
    @Transactional(readOnly = true)
    public PageResult<StagedFamilyResponse> listFamilies(final String workspaceId, final String uploadId,
                                                         final long offset, final Integer limit) {
        final int pageSize = resolveLimit(offset, limit);
        final Optional<UploadSession> session = resolveListableSession(workspaceId, uploadId);
        if (session.isEmpty()) {
            return PageResult.empty(offset, pageSize);
        }
        final Page<StagedFamily> page = stagedFamilyRepository.findByUploadIdAndImportStatusNot(
                session.get().getUploadId(), ImportStatus.IMPORTED, OffsetPageRequest.of(offset, pageSize));
        return PageResult.of(page, StagedFamilyResponse::from, offset, pageSize);
    }

    /**
     * Lists staged products of a session, optionally restricted to one family. Same session resolution
     * as {@link #listFamilies}.
     */
    @Transactional(readOnly = true)
    public PageResult<StagedProductResponse> listProducts(final String workspaceId, final String uploadId,
                                                          final Long familyId, final long offset,
                                                          final Integer limit) {
        final int pageSize = resolveLimit(offset, limit);
        final Optional<UploadSession> session = resolveListableSession(workspaceId, uploadId);
        if (session.isEmpty()) {
            return PageResult.empty(offset, pageSize);
        }
        final String resolvedId = session.get().getUploadId();
        final OffsetPageRequest pageRequest = OffsetPageRequest.of(offset, pageSize);
        final Page<StagedProduct> page = familyId == null
                ? stagedProductRepository.findByUploadIdAndImportStatusNot(resolvedId, ImportStatus.IMPORTED,
                                                                          pageRequest)
                : stagedProductRepository.findByUploadIdAndFamilyIdAndImportStatusNot(resolvedId, familyId,
                                                                                      ImportStatus.IMPORTED,
                                                                                      pageRequest);
        return PageResult.of(page, StagedProductResponse::from, offset, pageSize);
    }

    @Transactional(readOnly = true)
    public StagedProductResponse getProduct(final Long productId) {
        final StagedProduct product = findProduct(productId);
        return withChildren(product);
    }

    /**
     * Merges the non-null fields of {@code patch} into the product.
     *
     * @throws ConflictException if {@code patch.version} is set and no longer matches the stored row.
     */
    @Transactional
    public StagedProductResponse updateProduct(final Long productId, final StagedProductPatch patch) {
        final StagedProduct product = findProduct(productId);
        requireEditable(product.getUploadId());
        checkVersion("product", productId, patch.getVersion(), product.getVersion());

        if (patch.getImportStatus() != null && !REVIEWER_IMPORT_STATUSES.contains(patch.getImportStatus())) {
            throw new BadRequestException("import_status can only be set to 'pending' or 'approved'.");
        }
        if (patch.getFamilyId() != null) {
            final StagedFamily family = stagedFamilyRepository.findById(patch.getFamilyId())
                                                              .orElseThrow(() -> new BadRequestException(
                                                                      "Unknown family_id: " + patch.getFamilyId()));
            if (!family.getUploadId().equals(product.getUploadId())) {
                throw new BadRequestException("family_id belongs to a different upload session.");
            }
        }

        apply(patch.getName(), product::setName);
        apply(patch.getModelNumber(), product::setModelNumber);
        apply(patch.getDescription(), product::setDescription);
        apply(patch.getShortDescription(), product::setShortDescription);
        apply(patch.getCategory(), product::setCategory);
        apply(patch.getFamilyId(), product::setFamilyId);
        apply(patch.getBasePrice(), product::setBasePrice);
        apply(patch.getWidth(), product::setWidth);
        apply(patch.getDepth(), product::setDepth);
        apply(patch.getHeight(), product::setHeight);
        apply(patch.getWeight(), product::setWeight);
        apply(patch.getVolume(), product::setVolume);
        apply(patch.getFabricYardage(), product::setFabricYardage);
        apply(patch.getInStock(), product::setInStock);
        apply(patch.getRequiresReview(), product::setRequiresReview);
        apply(patch.getImportStatus(), product::setImportStatus);

        final StagedProduct saved = stagedProductRepository.saveAndFlush(product);
        log.info("Updated staged product {} of upload {}.", productId, saved.getUploadId());
        return withChildren(saved);
    }

    /**
     * Skips a product from import and removes its variations and images. Sibling products are not
     * touched.
     */
    @Transactional
    public StagedDeletionResult deleteProduct(final Long productId) {
        final StagedProduct product = findProduct(productId);
        requireEditable(product.getUploadId());

        final List<String> imagePaths = stagedImageRepository.findPathsByProductId(productId);
        final int variations = stagedVariationRepository.deleteAllByProductId(productId);
        final int images = stagedImageRepository.deleteAllByProductId(productId);
        product.setImportStatus(ImportStatus.SKIPPED);
        stagedProductRepository.save(product);

        imagePaths.stream()
                  .filter(path -> stagedImageRepository.countReferencingPath(path) == 0)
                  .forEach(this::deleteImageFileQuietly);

        log.info("Skipped staged product {} of upload {}: removed {} variations and {} images.", productId,
                 product.getUploadId(), variations, images);
        return new StagedDeletionResult(productId, variations, images);
    }

    @Transactional(readOnly = true)
    public List<StagedVariationResponse> listVariations(final Long productId) {
        findProduct(productId);
        return stagedVariationRepository.findByProductIdOrderByIdAsc(productId).stream()
                                        .map(StagedVariationResponse::from)
                                        .toList();
    }

    @Transactional(readOnly = true)
    public StagedVariationResponse getVariation(final Long variationId) {
        return StagedVariationResponse.from(findVariation(variationId));
    }

    @Transactional
    public StagedVariationResponse updateVariation(final Long variationId, final StagedVariationPatch patch) {
        final StagedVariation variation = findVariation(variationId);
        requireEditable(variation.getUploadId());
        checkVersion("variation", variationId, patch.getVersion(), variation.getVersion());

        apply(patch.getSku(), variation::setSku);
        apply(patch.getSuffix(), variation::setSuffix);
        apply(patch.getName(), variation::setName);
        apply(patch.getPriceAdjustment(), variation::setPriceAdjustment);
        apply(patch.getAvailable(), variation::setAvailable);

        final StagedVariation saved = stagedVariationRepository.saveAndFlush(variation);
        log.info("Updated staged variation {} of product {}.", variationId, saved.getProductId());
        return StagedVariationResponse.from(saved);
    }

    @Transactional
    public void deleteVariation(final Long variationId) {
        final StagedVariation variation = findVariation(variationId);
        requireEditable(variation.getUploadId());
        stagedVariationRepository.delete(variation);
        log.info("Deleted staged variation {} of product {}.", variationId, variation.getProductId());
    }

    @Transactional(readOnly = true)
    public List<StagedImageResponse> listImages(final Long productId) {
        findProduct(productId);
        return stagedImageRepository.findByProductIdOrderByIdAsc(productId).stream()
                                    .map(StagedImageResponse::from)
                                    .toList();
    }

    private Optional<UploadSession> resolveListableSession(final String workspaceId, final String uploadId) {
        if (uploadId == null) {
            final Optional<UploadSession> latest = uploadSessionRepository.findLatestActive(workspaceId);
            if (latest.isEmpty()) {
                log.debug("Workspace '{}' has no completed upload session to review.", workspaceId);
            }
            return latest;
        }
        final UploadSession session = uploadSessionRepository.findById(uploadId)
                                                             .orElseThrow(() -> new NotFoundException(
                                                                     "Upload session not found with ID: " + uploadId));
        if (session.getStatus() == UploadStatus.EXPIRED) {
            return Optional.empty();
        }
        return Optional.of(session);
    }

    private int resolveLimit(final long offset, final Integer limit) {
        if (offset < 0) {
            throw new BadRequestException("offset must not be negative.");
        }
        if (limit == null) {
            return config.getPaging().getDefaultLimit();
        }
        if (limit < 1 || limit > config.getPaging().getMaxLimit()) {
            throw new BadRequestException(
                    String.format("limit must be between 1 and %d.", config.getPaging().getMaxLimit()));
        }
        return limit;
    }

    private void requireEditable(final String uploadId) {
        final UploadSession session = uploadSessionRepository.findById(uploadId)
                                                             .orElseThrow(() -> new NotFoundException(
                                                                     "Upload session not found with ID: " + uploadId));
        if (session.getStatus().isFrozen()) {
            throw new StagedDataFrozenException(String.format(
                    "Staged data of upload %s is %s and can no longer be changed.", uploadId,
                    session.getStatus().getValue()));
        }
        if (UploadStatus.IN_FLIGHT.contains(session.getStatus())) {
            throw new StagedDataFrozenException(String.format(
                    "Upload %s is still %s; wait for parsing to finish before editing.", uploadId,
                    session.getStatus().getValue()));
        }
    }

    private static void checkVersion(final String entity, final Long id, final Long expected, final Long actual) {
        if (expected != null && !Objects.equals(expected, actual)) {
            throw new ConflictException(String.format(
                    "Staged %s %d was modified concurrently (expected version %d, found %d).", entity, id,
                    expected, actual));
        }
    }

    private StagedProduct findProduct(final Long productId) {
        return stagedProductRepository.findById(productId)
                                      .orElseThrow(() -> new NotFoundException(
                                              "Staged product not found with ID: " + productId));
    }

    private StagedVariation findVariation(final Long variationId) {
        return stagedVariationRepository.findById(variationId)
                                        .orElseThrow(() -> new NotFoundException(
                                                "Staged variation not found with ID: " + variationId));
    }

    private StagedProductResponse withChildren(final StagedProduct product) {
        final List<StagedVariationResponse> variations = stagedVariationRepository
                .findByProductIdOrderByIdAsc(product.getId()).stream().map(StagedVariationResponse::from).toList();
        final List<StagedImageResponse> images = stagedImageRepository
                .findByProductIdOrderByIdAsc(product.getId()).stream().map(StagedImageResponse::from).toList();
        return StagedProductResponse.from(product, variations, images);
    }

    private void deleteImageFileQuietly(final String path) {
        try {
            fileStore.delete(path);
        } catch (FileStoreException e) {
            log.warn("Could not delete image file '{}'; the orphan sweep will pick it up.", path, e);
        }
    }

    private static <T> void apply(final T value, final Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
