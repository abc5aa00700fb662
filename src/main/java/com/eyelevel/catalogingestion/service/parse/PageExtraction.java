package com.eyelevel.catalogingestion.service.parse;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Stream;

/**
 * Everything a {@link CatalogPageExtractor} found on one catalog page, before it is staged.
 *
 * @param pageNumber 1-based page number, recorded as {@code source_page} on staged rows.
 * @param familyName Family heading of the page, or {@code null} if none was recognised.
 * @param products   Products in reading order.
 * @param images     Product images in reading order; backgrounds and icons are already dropped.
 */
public record PageExtraction(int pageNumber, String familyName, List<Product> products, List<Image> images) {

    public static PageExtraction empty(int pageNumber) {
        return new PageExtraction(pageNumber, null, List.of(), List.of());
    }

    public boolean hasProducts() {
        return !products.isEmpty();
    }

    public record Product(String modelNumber, String name, Long basePrice, Dimensions dimensions,
                          List<Variation> variations) {
    }

    public record Variation(String sku, String suffix) {
    }

    public record Image(byte[] png, int width, int height) {
    }

    /**
     * Physical attributes in inches, pounds, cubic feet and yards. Any of them may be {@code null}.
     */
    public record Dimensions(BigDecimal height, BigDecimal width, BigDecimal depth, BigDecimal weight,
                             BigDecimal volume, BigDecimal fabricYardage) {

        public static final Dimensions NONE = new Dimensions(null, null, null, null, null, null);

        public long presentCount() {
            return Stream.of(height, width, depth, weight, volume, fabricYardage)
                         .filter(value -> value != null && value.signum() > 0).count();
        }
    }
}
