package com.eyelevel.catalogingestion.service.parse;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link CatalogPageExtractor}: finds furniture model numbers such as {@code 1234SB} in the page
 * text, groups them by their four digit base model, and pulls dimensions and embedded product images
 * from the same page.
 */
@Slf4j
@Component
public class TextPatternPageExtractor implements CatalogPageExtractor {

    private static final Pattern MODEL_NUMBER = Pattern.compile("\\b(\\d{4})([A-Z][\\w-]*)\\b");
    private static final Pattern INCHES = Pattern.compile("(\\d+(?:\\.\\d+)?)\"");
    private static final Pattern POUNDS = Pattern.compile("(\\d+)#");
    private static final Pattern CUBIC_FEET = Pattern.compile("([\\d.]+)\\s*cu\\.?\\s*ft", Pattern.CASE_INSENSITIVE);
    private static final Pattern YARDS = Pattern.compile("([\\d.]+)y\\b");
    private static final Pattern PRICE = Pattern.compile("\\$\\s?(\\d{1,3}(?:,\\d{3})+|\\d+)(?:\\.(\\d{2}))?");
    private static final Pattern FAMILY_HEADING = Pattern.compile("^[A-Z][A-Z &'-]{2,60}$");

    static final int BACKGROUND_MIN_SIDE = 2000;
    static final int ICON_MAX_SIDE = 50;

    @Override
    public PageExtraction extract(final PDDocument document, final int pageNumber) throws IOException {
        final PDFTextStripper stripper = new PDFTextStripper();
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        final String text = stripper.getText(document);

        final Map<String, List<PageExtraction.Variation>> modelsByBase = findModels(text);
        if (modelsByBase.isEmpty()) {
            log.debug("No model numbers found on page {}.", pageNumber);
            return PageExtraction.empty(pageNumber);
        }

        final PageExtraction.Dimensions dimensions = findDimensions(text);
        final Long basePrice = findPrice(text);
        final List<PageExtraction.Product> products = new ArrayList<>();
        modelsByBase.forEach((base, variations) -> products.add(
                new PageExtraction.Product(base, "Model " + base, basePrice, dimensions, variations)));

        final List<PageExtraction.Image> images = extractImages(document.getPage(pageNumber - 1), pageNumber);
        return new PageExtraction(pageNumber, findFamilyName(text), products, images);
    }

    Map<String, List<PageExtraction.Variation>> findModels(final String text) {
        final Map<String, Set<String>> fullModelsByBase = new LinkedHashMap<>();
        final Matcher matcher = MODEL_NUMBER.matcher(text);
        while (matcher.find()) {
            final String base = matcher.group(1);
            final String suffix = matcher.group(2);
            if (isFalsePositive(base, suffix, text, matcher.start())) {
                continue;
            }
            fullModelsByBase.computeIfAbsent(base, key -> new LinkedHashSet<>()).add(base + suffix);
        }

        final Map<String, List<PageExtraction.Variation>> result = new LinkedHashMap<>();
        fullModelsByBase.forEach((base, fullModels) -> result.put(base, fullModels.stream()
                .map(fullModel -> new PageExtraction.Variation(fullModel, fullModel.substring(base.length())))
                .toList()));
        return result;
    }

    /**
     * Years followed by a word ("2024Catalog") and phone or order numbers preceded by a dash or a
     * hash are not model numbers.
     */
    private static boolean isFalsePositive(final String base, final String suffix, final String text, final int start) {
        final int year = Integer.parseInt(base);
        if (year >= 1900 && year <= 2099 && suffix.length() > 3 && suffix.chars().skip(1).allMatch(Character::isLowerCase)) {
            return true;
        }
        if (start > 0) {
            final char previous = text.charAt(start - 1);
            return previous == '-' || previous == '#' || previous == '(';
        }
        return false;
    }

    PageExtraction.Dimensions findDimensions(final String text) {
        final List<BigDecimal> inches = new ArrayList<>();
        final Matcher inchMatcher = INCHES.matcher(text);
        while (inchMatcher.find() && inches.size() < 3) {
            inches.add(new BigDecimal(inchMatcher.group(1)));
        }
        return new PageExtraction.Dimensions(
                inches.size() > 0 ? inches.get(0) : null,
                inches.size() > 1 ? inches.get(1) : null,
                inches.size() > 2 ? inches.get(2) : null,
                firstDecimal(POUNDS, text),
                firstDecimal(CUBIC_FEET, text),
                firstDecimal(YARDS, text));
    }

    private static BigDecimal firstDecimal(final Pattern pattern, final String text) {
        final Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            try {
                return new BigDecimal(matcher.group(1));
            } catch (NumberFormatException e) {
                log.trace("Skipping unparsable value '{}'.", matcher.group(1));
            }
        }
        return null;
    }

    /**
     * First dollar amount on the page, in cents.
     */
    Long findPrice(final String text) {
        final Matcher matcher = PRICE.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        final long dollars = Long.parseLong(matcher.group(1).replace(",", ""));
        final long cents = matcher.group(2) == null ? 0 : Long.parseLong(matcher.group(2));
        return dollars * 100 + cents;
    }

    String findFamilyName(final String text) {
        for (String line : text.split("\\R")) {
            final String candidate = line.trim();
            if (FAMILY_HEADING.matcher(candidate).matches()) {
                return candidate;
            }
        }
        return null;
    }

    private List<PageExtraction.Image> extractImages(final PDPage page, final int pageNumber) {
        final List<PageExtraction.Image> images = new ArrayList<>();
        final PDResources resources = page.getResources();
        if (resources == null) {
            return images;
        }
        for (COSName name : resources.getXObjectNames()) {
            try {
                final PDXObject xObject = resources.getXObject(name);
                if (!(xObject instanceof PDImageXObject image)) {
                    continue;
                }
                final int width = image.getWidth();
                final int height = image.getHeight();
                if (!isProductImage(width, height)) {
                    log.trace("Dropping {}x{} image {} on page {}.", width, height, name.getName(), pageNumber);
                    continue;
                }
                images.add(new PageExtraction.Image(toPng(image.getImage()), width, height));
            } catch (IOException e) {
                log.warn("Could not read image {} on page {}; skipping it.", name.getName(), pageNumber, e);
            }
        }
        return images;
    }

    /**
     * Backgrounds (longest side above 2000px) and icons (shortest side below 50px) are not product shots.
     */
    static boolean isProductImage(final int width, final int height) {
        if (Math.max(width, height) > BACKGROUND_MIN_SIDE) {
            return false;
        }
        return Math.min(width, height) >= ICON_MAX_SIDE;
    }

    private static byte[] toPng(final BufferedImage image) throws IOException {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }
}
