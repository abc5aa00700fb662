package com.eyelevel.catalogingestion.service.parse;

import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;

/**
 * Turns one page of a loaded catalog into families, products, variations and images.
 * Implementations must be stateless; the same instance serves concurrent parse jobs.
 */
public interface CatalogPageExtractor {

    /**
     * @param document   The open catalog.
     * @param pageNumber 1-based page number.
     *
     * @throws IOException if the page content cannot be read.
     */
    PageExtraction extract(PDDocument document, int pageNumber) throws IOException;
}
