package com.eyelevel.catalogingestion.service.parse;

import com.eyelevel.catalogingestion.config.CatalogIngestionConfig;
import com.eyelevel.catalogingestion.model.ImageRole;
import com.eyelevel.catalogingestion.model.StagedFamily;
import com.eyelevel.catalogingestion.model.StagedImage;
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
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Persists what the extractor found on one page. Each page is committed on its own so staged rows
 * become visible to reviewers while the rest of the document is still being parsed.
 * <p>
 * The session row is locked for the duration of the write. A page is only staged while its session is
 * still {@code parsing}; once the session was deleted, expired or failed the page is dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StagedRowWriter {

    static final String UNKNOWN_FAMILY = "Unknown";

    private final StagedFamilyRepository stagedFamilyRepository;
    private final StagedProductRepository stagedProductRepository;
    private final StagedVariationRepository stagedVariationRepository;
    private final StagedImageRepository stagedImageRepository;
    private final UploadSessionRepository uploadSessionRepository;
    private final ExtractionConfidenceScorer confidenceScorer;
    private final FileStore fileStore;
    private final CatalogIngestionConfig config;

    /**
     * @return the number of rows written per entity type; {@link ParseCounts#EMPTY} for a page without
     * products or when the session no longer accepts rows.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ParseCounts write(final String uploadId, final PageExtraction page) {
        if (!page.hasProducts()) {
            return ParseCounts.EMPTY;
        }
        final int pageNumber = page.pageNumber();
        final UploadSession session = uploadSessionRepository.findByIdForUpdate(uploadId).orElse(null);
        if (session == null || session.getStatus() != UploadStatus.PARSING) {
            log.warn("[{}] Session is {}; dropping page {}.", uploadId,
                     session == null ? "gone" : session.getStatus(), pageNumber);
            return ParseCounts.EMPTY;
        }

        final StagedFamily family = stagedFamilyRepository.save(StagedFamily.builder()
                .uploadId(uploadId)
                .name(StringUtils.hasText(page.familyName()) ? page.familyName() : UNKNOWN_FAMILY)
                .sourcePage(pageNumber)
                .extractionConfidence(config.getParse().getFamilyConfidence())
                .build());

        final List<String> imageKeys = storeImages(uploadId, page);
        final List<List<Integer>> imagesPerProduct = distributeImages(imageKeys.size(), page.products().size());

        int variations = 0;
        int images = 0;
        for (int i = 0; i < page.products().size(); i++) {
            final PageExtraction.Product extracted = page.products().get(i);
            final List<Integer> imageIndexes = imagesPerProduct.get(i);
            final int confidence = confidenceScorer.score(extracted, imageIndexes.size());

            final PageExtraction.Dimensions dimensions = extracted.dimensions();
            final StagedProduct product = stagedProductRepository.save(StagedProduct.builder()
                    .uploadId(uploadId)
                    .familyId(family.getId())
                    .name(extracted.name())
                    .modelNumber(extracted.modelNumber())
                    .basePrice(extracted.basePrice())
                    .height(dimensions.height())
                    .width(dimensions.width())
                    .depth(dimensions.depth())
                    .weight(dimensions.weight())
                    .volume(dimensions.volume())
                    .fabricYardage(dimensions.fabricYardage())
                    .extractionConfidence(confidence)
                    .requiresReview(confidence < config.getParse().getReviewThreshold())
                    .sourcePage(pageNumber)
                    .build());

            for (PageExtraction.Variation variation : extracted.variations()) {
                stagedVariationRepository.save(StagedVariation.builder()
                        .uploadId(uploadId)
                        .productId(product.getId())
                        .sku(variation.sku())
                        .suffix(variation.suffix())
                        .name(extracted.name() + " " + variation.suffix())
                        .extractionConfidence(config.getParse().getVariationConfidence())
                        .build());
                variations++;
            }

            for (int position = 0; position < imageIndexes.size(); position++) {
                final int index = imageIndexes.get(position);
                final PageExtraction.Image image = page.images().get(index);
                stagedImageRepository.save(StagedImage.builder()
                        .uploadId(uploadId)
                        .productId(product.getId())
                        .path(imageKeys.get(index))
                        .width(image.width())
                        .height(image.height())
                        .sourcePage(pageNumber)
                        .roles(rolesFor(position, imageIndexes.size()))
                        .build());
                images++;
            }
        }

        log.debug("[{}] Page {}: staged {} products, {} variations, {} images.", uploadId, pageNumber,
                  page.products().size(), variations, images);
        return new ParseCounts(1, page.products().size(), variations, images);
    }

    private List<String> storeImages(final String uploadId, final PageExtraction page) {
        final List<String> keys = new ArrayList<>();
        for (int i = 0; i < page.images().size(); i++) {
            final String key = FileStore.imagePrefix(uploadId) + "page" + page.pageNumber() + "_img" + i + ".png";
            fileStore.store(key, page.images().get(i).png());
            keys.add(key);
        }
        return keys;
    }

    /**
     * Splits the page's images across its products in reading order, at least one per product while
     * images last; the last product takes any remainder.
     */
    static List<List<Integer>> distributeImages(final int imageCount, final int productCount) {
        final List<List<Integer>> result = new ArrayList<>();
        final int perProduct = Math.max(1, imageCount / Math.max(1, productCount));
        int next = 0;
        for (int p = 0; p < productCount; p++) {
            final List<Integer> indexes = new ArrayList<>();
            final int end = p == productCount - 1 ? imageCount : Math.min(imageCount, next + perProduct);
            while (next < end) {
                indexes.add(next++);
            }
            result.add(indexes);
        }
        return result;
    }

    /**
     * First image is primary, second is hover, all are gallery. A lone image serves as primary and
     * hover at once.
     */
    static Set<ImageRole> rolesFor(final int position, final int imageCount) {
        final Set<ImageRole> roles = EnumSet.of(ImageRole.GALLERY);
        if (position == 0) {
            roles.add(ImageRole.PRIMARY);
            if (imageCount == 1) {
                roles.add(ImageRole.HOVER);
            }
        } else if (position == 1) {
            roles.add(ImageRole.HOVER);
        }
        return roles;
    }
}
