package com.eyelevel.catalogingestion.service.parse;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Scores how complete an extracted product is, 0 to 100. Drives the {@code requires_review} flag.
 */
@Component
public class ExtractionConfidenceScorer {

    static final int NO_MODEL_SCORE = 10;

    public int score(final PageExtraction.Product product, final int imageCount) {
        if (!StringUtils.hasText(product.modelNumber())) {
            return NO_MODEL_SCORE;
        }
        int score = 30;

        final long presentDimensions = product.dimensions().presentCount();
        if (presentDimensions > 0) {
            score += 20;
        }
        if (presentDimensions >= 6) {
            score += 5;
        }

        if (imageCount > 0) {
            score += 20;
            if (imageCount > 1) {
                score += 10;
            }
        }

        if (!product.variations().isEmpty()) {
            score += 15;
        }
        return Math.min(100, score);
    }
}
