package com.eyelevel.catalogingestion.client;

import com.eyelevel.catalogingestion.dto.staged.StagedFamilyResponse;
import com.eyelevel.catalogingestion.dto.staged.StagedProductResponse;

import java.util.List;

/**
 * Everything a reviewer looks at for one session.
 */
public record ReviewState(String uploadId, List<StagedFamilyResponse> families,
                          List<StagedProductResponse> products) {
}
