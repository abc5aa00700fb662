package com.eyelevel.catalogingestion.service.importer;

import com.eyelevel.catalogingestion.dto.importer.ProductionImportResult;
import com.eyelevel.catalogingestion.exception.AlreadyImportedException;
import com.eyelevel.catalogingestion.exception.apiclient.NotFoundException;
import com.eyelevel.catalogingestion.model.CatalogFamily;
import com.eyelevel.catalogingestion.model.CatalogImage;
import com.eyelevel.catalogingestion.model.CatalogProduct;
import com.eyelevel.catalogingestion.model.CatalogVariation;
import com.eyelevel.catalogingestion.model.ImageRole;
import com.eyelevel.catalogingestion.model.ImportStatus;
import com.eyelevel.catalogingestion.model.StagedFamily;
import com.eyelevel.catalogingestion.model.StagedImage;
import com.eyelevel.catalogingestion.model.StagedProduct;
import com.eyelevel.catalogingestion.model.StagedVariation;
import com.eyelevel.catalogingestion.model.UploadSession;
import com.eyelevel.catalogingestion.model.UploadStatus;
import com.eyelevel.catalogingestion.repository.CatalogFamilyRepository;
import com.eyelevel.catalogingestion.repository.CatalogImageRepository;
import com.eyelevel.catalogingestion.repository.CatalogProductRepository;
import com.eyelevel.catalogingestion.repository.CatalogVariationRepository;
import com.eyelevel.catalogingestion.repository.StagedFamilyRepository;
import com.eyelevel.catalogingestion.repository.StagedImageRepository;
import com.eyelevel.catalogingestion.repository.StagedProductRepository;
import com.eyelevel.catalogingestion.repository.StagedVariationRepository;
import com.eyelevel.catalogingestion.repository.UploadSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Copies a reviewed session from staging into the production catalog.
 * <p>
 * The whole import is one database transaction bounded by {@code app.ingestion.importer.timeout-seconds}:
 * either every row is written and the session becomes {@code imported}, or nothing is visible in
 * production. The session row is locked for the duration so a concurrent import, delete or expiry of
 * the same session waits and then sees the new status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductionImporter {

    private final UploadSessionRepository uploadSessionRepository;
    private final StagedFamilyRepository stagedFamilyRepository;
    private final StagedProductRepository stagedProductRepository;
    private final StagedVariationRepository stagedVariationRepository;
    private final StagedImageRepository stagedImageRepository;
    private final CatalogFamilyRepository catalogFamilyRepository;
    private final CatalogProductRepository catalogProductRepository;
    private final CatalogVariationRepository catalogVariationRepository;
    private final CatalogImageRepository catalogImageRepository;

    /**
     * @throws NotFoundException        if the session does not exist.
     * @throws AlreadyImportedException if the session is not {@code completed}.
     */
    @Transactional(timeoutString = "${app.ingestion.importer.timeout-seconds:300}")
    public ProductionImportResult importSession(final String uploadId) {
        final UploadSession session = uploadSessionRepository.findByIdForUpdate(uploadId)
                                                             .orElseThrow(() -> new NotFoundException(
                                                                     "Upload session not found with ID: " + uploadId));
        if (session.getStatus() != UploadStatus.COMPLETED) {
            log.warn("Rejected import of upload {}: status is {}.", uploadId, session.getStatus());
            throw new AlreadyImportedException(uploadId, session.getStatus());
        }
        log.info("Importing upload {} into the production catalog.", uploadId);

        final Map<Long, Long> familyIds = importFamilies(uploadId);

        final List<StagedProduct> products = stagedProductRepository.findByUploadIdAndImportStatusNotOrderByIdAsc(
                uploadId, ImportStatus.SKIPPED);
        final int skipped = (int) (stagedProductRepository.countByUploadId(uploadId) - products.size());
        final Map<Long, Long> productIds = importProducts(uploadId, products, familyIds);

        int variations = 0;
        int images = 0;
        if (!productIds.isEmpty()) {
            variations = importVariations(uploadId, productIds);
            images = importImages(uploadId, productIds);
        }

        stagedFamilyRepository.markImportedByUploadId(uploadId, ImportStatus.IMPORTED);
        stagedProductRepository.markImportedByUploadId(uploadId, ImportStatus.IMPORTED, ImportStatus.SKIPPED);

        session.setStatus(UploadStatus.IMPORTED);
        session.setImportedAt(LocalDateTime.now());
        session.setCurrentStep("Imported");
        uploadSessionRepository.save(session);

        final ProductionImportResult result = new ProductionImportResult(uploadId, familyIds.size(),
                                                                         productIds.size(), variations, images,
                                                                         skipped);
        log.info("Imported upload {}: {}", uploadId, result);
        return result;
    }

    private Map<Long, Long> importFamilies(final String uploadId) {
        final Map<Long, Long> catalogIdByStagedId = new HashMap<>();
        for (StagedFamily staged : stagedFamilyRepository.findByUploadIdOrderByIdAsc(uploadId)) {
            final CatalogFamily family = catalogFamilyRepository.save(CatalogFamily.builder()
                    .name(staged.getName())
                    .description(staged.getDescription())
                    .category(staged.getCategory())
                    .sourceUploadId(uploadId)
                    .build());
            catalogIdByStagedId.put(staged.getId(), family.getId());
        }
        return catalogIdByStagedId;
    }

    private Map<Long, Long> importProducts(final String uploadId, final List<StagedProduct> products,
                                           final Map<Long, Long> familyIds) {
        final Map<Long, Long> catalogIdByStagedId = new HashMap<>();
        for (StagedProduct staged : products) {
            final CatalogProduct product = catalogProductRepository.save(CatalogProduct.builder()
                    .familyId(staged.getFamilyId() == null ? null : familyIds.get(staged.getFamilyId()))
                    .name(staged.getName())
                    .modelNumber(staged.getModelNumber())
                    .description(staged.getDescription())
                    .shortDescription(staged.getShortDescription())
                    .category(staged.getCategory())
                    .basePrice(staged.getBasePrice())
                    .width(staged.getWidth())
                    .depth(staged.getDepth())
                    .height(staged.getHeight())
                    .weight(staged.getWeight())
                    .volume(staged.getVolume())
                    .fabricYardage(staged.getFabricYardage())
                    .inStock(staged.getInStock())
                    .sourceUploadId(uploadId)
                    .sourceStagedProductId(staged.getId())
                    .build());
            catalogIdByStagedId.put(staged.getId(), product.getId());
        }
        return catalogIdByStagedId;
    }

    private int importVariations(final String uploadId, final Map<Long, Long> productIds) {
        final List<StagedVariation> variations = stagedVariationRepository.findByProductIdInOrderByIdAsc(
                productIds.keySet());
        for (StagedVariation staged : variations) {
            catalogVariationRepository.save(CatalogVariation.builder()
                    .productId(productIds.get(staged.getProductId()))
                    .sku(staged.getSku())
                    .suffix(staged.getSuffix())
                    .name(staged.getName())
                    .priceAdjustment(staged.getPriceAdjustment())
                    .available(staged.isAvailable())
                    .sourceUploadId(uploadId)
                    .build());
        }
        return variations.size();
    }

    private int importImages(final String uploadId, final Map<Long, Long> productIds) {
        final List<StagedImage> images = stagedImageRepository.findByProductIdInOrderByIdAsc(productIds.keySet());
        for (StagedImage staged : images) {
            catalogImageRepository.save(CatalogImage.builder()
                    .productId(productIds.get(staged.getProductId()))
                    .path(staged.getPath())
                    .width(staged.getWidth())
                    .height(staged.getHeight())
                    .roles(copyRoles(staged.getRoles()))
                    .sourceUploadId(uploadId)
                    .build());
        }
        return images.size();
    }

    private static Set<ImageRole> copyRoles(final Set<ImageRole> roles) {
        final Set<ImageRole> copy = EnumSet.noneOf(ImageRole.class);
        if (roles != null) {
            copy.addAll(roles);
        }
        return copy;
    }
}
