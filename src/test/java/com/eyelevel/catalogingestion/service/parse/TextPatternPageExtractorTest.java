package com.eyelevel.catalogingestion.service.parse;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TextPatternPageExtractorTest {

    private final TextPatternPageExtractor extractor = new TextPatternPageExtractor();

    @Test
    void groupsModelNumbersByBaseModel() {
        Map<String, List<PageExtraction.Variation>> models = extractor.findModels(
                "Sofa 1234SB and loveseat 1234LS, chair 5678C");

        assertThat(models).containsOnlyKeys("1234", "5678");
        assertThat(models.get("1234")).containsExactly(new PageExtraction.Variation("1234SB", "SB"),
                                                       new PageExtraction.Variation("1234LS", "LS"));
        assertThat(models.get("5678")).containsExactly(new PageExtraction.Variation("5678C", "C"));
    }

    @Test
    void ignoresYearsFollowedByWordsAndPrefixedNumbers() {
        Map<String, List<PageExtraction.Variation>> models = extractor.findModels(
                "2024Catalog edition. Call 800-5551234X or order #4321AB (9876Z)");

        assertThat(models).isEmpty();
    }

    @Test
    void keepsShortSuffixesOnYearLikeBases() {
        assertThat(extractor.findModels("Model 2020SB")).containsOnlyKeys("2020");
    }

    @Test
    void readsDimensionsInOrder() {
        PageExtraction.Dimensions dimensions = extractor.findDimensions(
                "H 36\" W 84.5\" D 40\" 120# 45.2 cu ft 16y");

        assertThat(dimensions.height()).isEqualByComparingTo("36");
        assertThat(dimensions.width()).isEqualByComparingTo("84.5");
        assertThat(dimensions.depth()).isEqualByComparingTo("40");
        assertThat(dimensions.weight()).isEqualByComparingTo("120");
        assertThat(dimensions.volume()).isEqualByComparingTo(new BigDecimal("45.2"));
        assertThat(dimensions.fabricYardage()).isEqualByComparingTo("16");
        assertThat(dimensions.presentCount()).isEqualTo(6);
    }

    @Test
    void leavesMissingDimensionsEmpty() {
        PageExtraction.Dimensions dimensions = extractor.findDimensions("Width 30\" only");

        assertThat(dimensions.height()).isEqualByComparingTo("30");
        assertThat(dimensions.width()).isNull();
        assertThat(dimensions.weight()).isNull();
        assertThat(dimensions.presentCount()).isEqualTo(1);
    }

    @Test
    void convertsFirstPriceToCents() {
        assertThat(extractor.findPrice("Starting at $1,299.50, upgrade $200")).isEqualTo(129950L);
        assertThat(extractor.findPrice("Only $899")).isEqualTo(89900L);
        assertThat(extractor.findPrice("Call for pricing")).isNull();
    }

    @Test
    void picksUpperCaseHeadingAsFamilyName() {
        assertThat(extractor.findFamilyName("page 3\nBRENTWOOD COLLECTION\n1234SB Sofa")).isEqualTo(
                "BRENTWOOD COLLECTION");
        assertThat(extractor.findFamilyName("no heading here\n1234SB")).isNull();
    }

    @Test
    void dropsBackgroundsAndIcons() {
        assertThat(TextPatternPageExtractor.isProductImage(800, 600)).isTrue();
        assertThat(TextPatternPageExtractor.isProductImage(2400, 1200)).isFalse();
        assertThat(TextPatternPageExtractor.isProductImage(40, 300)).isFalse();
        assertThat(TextPatternPageExtractor.isProductImage(50, 2000)).isTrue();
    }

    @Test
    void extractsProductsFromRenderedPage() throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                content.setLeading(16);
                content.newLineAtOffset(50, 700);
                content.showText("HARBOR COLLECTION");
                content.newLine();
                content.showText("Sofa 4411SB Loveseat 4411LS");
                content.newLine();
                content.showText("H 34\" W 88\" D 38\" $1,499");
                content.endText();
            }

            PageExtraction extraction = extractor.extract(document, 1);

            assertThat(extraction.pageNumber()).isEqualTo(1);
            assertThat(extraction.familyName()).isEqualTo("HARBOR COLLECTION");
            assertThat(extraction.products()).hasSize(1);
            PageExtraction.Product product = extraction.products().get(0);
            assertThat(product.modelNumber()).isEqualTo("4411");
            assertThat(product.name()).isEqualTo("Model 4411");
            assertThat(product.basePrice()).isEqualTo(149900L);
            assertThat(product.variations()).extracting(PageExtraction.Variation::suffix).containsExactly("SB", "LS");
            assertThat(extraction.images()).isEmpty();
        }
    }

    @Test
    void returnsEmptyExtractionForPageWithoutModels() throws IOException {
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage());

            PageExtraction extraction = extractor.extract(document, 1);

            assertThat(extraction.hasProducts()).isFalse();
        }
    }
}
