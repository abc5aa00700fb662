package com.eyelevel.catalogingestion.dto.importer;

/**
 * Rows written to the production catalog by one import. Not persisted.
 */
public record ProductionImportResult(
        String uploadId,
        int familiesImported,
        int productsImported,
        int variationsImported,
        int imagesImported,
        int productsSkipped) {
}
