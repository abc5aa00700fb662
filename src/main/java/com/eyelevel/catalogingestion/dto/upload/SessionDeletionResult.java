package com.eyelevel.catalogingestion.dto.upload;

/**
 * What an explicit session clear removed, per entity type.
 */
public record SessionDeletionResult(String uploadId, int families, int products, int variations, int images,
                                    int files) {
}
