package com.eyelevel.catalogingestion.dto.staged;

/**
 * Result of skipping a staged product: the product stays, marked {@code skipped}, while its children
 * are removed.
 */
public record StagedDeletionResult(Long productId, int variationsDeleted, int imagesDeleted) {
}
