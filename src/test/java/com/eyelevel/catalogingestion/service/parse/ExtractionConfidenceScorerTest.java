package com.eyelevel.catalogingestion.service.parse;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionConfidenceScorerTest {

    private static final PageExtraction.Dimensions FULL = new PageExtraction.Dimensions(BigDecimal.ONE,
            BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE);
    private static final List<PageExtraction.Variation> ONE_VARIATION = List.of(
            new PageExtraction.Variation("1234SB", "SB"));

    private final ExtractionConfidenceScorer scorer = new ExtractionConfidenceScorer();

    @Test
    void productWithoutModelScoresLow() {
        PageExtraction.Product product = new PageExtraction.Product(null, "Unnamed", null, FULL, ONE_VARIATION);

        assertThat(scorer.score(product, 3)).isEqualTo(ExtractionConfidenceScorer.NO_MODEL_SCORE);
    }

    @Test
    void bareModelScoresBaseline() {
        PageExtraction.Product product = new PageExtraction.Product("1234", "Model 1234", null,
                                                                    PageExtraction.Dimensions.NONE, List.of());

        assertThat(scorer.score(product, 0)).isEqualTo(30);
    }

    @Test
    void partialDimensionsAndSingleImage() {
        PageExtraction.Dimensions partial = new PageExtraction.Dimensions(BigDecimal.TEN, null, null, null, null,
                                                                          null);
        PageExtraction.Product product = new PageExtraction.Product("1234", "Model 1234", null, partial,
                                                                    ONE_VARIATION);

        assertThat(scorer.score(product, 1)).isEqualTo(30 + 20 + 20 + 15);
    }

    @Test
    void completeProductIsCappedAtHundred() {
        PageExtraction.Product product = new PageExtraction.Product("1234", "Model 1234", 9900L, FULL,
                                                                    ONE_VARIATION);

        assertThat(scorer.score(product, 4)).isEqualTo(100);
    }
}
