package com.eyelevel.catalogingestion.controller;

import com.eyelevel.catalogingestion.dto.common.ApiResponse;
import com.eyelevel.catalogingestion.dto.staged.PageResult;
import com.eyelevel.catalogingestion.dto.staged.StagedDeletionResult;
import com.eyelevel.catalogingestion.dto.staged.StagedFamilyResponse;
import com.eyelevel.catalogingestion.dto.staged.StagedImageResponse;
import com.eyelevel.catalogingestion.dto.staged.StagedProductPatch;
import com.eyelevel.catalogingestion.dto.staged.StagedProductResponse;
import com.eyelevel.catalogingestion.dto.staged.StagedVariationPatch;
import com.eyelevel.catalogingestion.dto.staged.StagedVariationResponse;
import com.eyelevel.catalogingestion.service.staging.StagedDataService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for reviewing staged families, products, variations and images.
 */
@Slf4j
@RestController
@RequestMapping("/staged")
@RequiredArgsConstructor
@Validated
public class StagedDataController implements StagedDataApi {

    private final StagedDataService stagedDataService;

    // --- 1. LISTINGS ---

    @Override
    @GetMapping("/families")
    public ResponseEntity<ApiResponse<PageResult<StagedFamilyResponse>>> listFamilies(
            @RequestHeader(value = "X-Workspace-Id", defaultValue = "default") final String workspaceId,
            @RequestParam(value = "upload_id", required = false) final String uploadId,
            @RequestParam(value = "offset", defaultValue = "0") final long offset,
            @RequestParam(value = "limit", required = false) final Integer limit) {

        log.debug("Listing staged families of upload {} (workspace '{}'), offset: {}, limit: {}", uploadId,
                  workspaceId, offset, limit);
        return ok(stagedDataService.listFamilies(workspaceId, uploadId, offset, limit),
                  "Staged families retrieved successfully.");
    }

    @Override
    @GetMapping("/products")
    public ResponseEntity<ApiResponse<PageResult<StagedProductResponse>>> listProducts(
            @RequestHeader(value = "X-Workspace-Id", defaultValue = "default") final String workspaceId,
            @RequestParam(value = "upload_id", required = false) final String uploadId,
            @RequestParam(value = "family_id", required = false) final Long familyId,
            @RequestParam(value = "offset", defaultValue = "0") final long offset,
            @RequestParam(value = "limit", required = false) final Integer limit) {

        log.debug("Listing staged products of upload {} (workspace '{}'), family: {}, offset: {}, limit: {}",
                  uploadId, workspaceId, familyId, offset, limit);
        return ok(stagedDataService.listProducts(workspaceId, uploadId, familyId, offset, limit),
                  "Staged products retrieved successfully.");
    }

    // --- 2. PRODUCTS ---

    @Override
    @GetMapping("/products/{productId}")
    public ResponseEntity<ApiResponse<StagedProductResponse>> getProduct(
            @PathVariable @Positive(message = "The 'productId' must be a positive number.") final Long productId) {
        return ok(stagedDataService.getProduct(productId), "Staged product retrieved successfully.");
    }

    @Override
    @PatchMapping("/products/{productId}")
    public ResponseEntity<ApiResponse<StagedProductResponse>> updateProduct(
            @PathVariable @Positive(message = "The 'productId' must be a positive number.") final Long productId,
            @RequestBody @Valid final StagedProductPatch patch) {

        log.info("Updating staged product {}: {}", productId, patch);
        ApiResponse<StagedProductResponse> response = ApiResponse.<StagedProductResponse>builder()
                .response(stagedDataService.updateProduct(productId, patch))
                .displayMessage("Staged product updated successfully.")
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @DeleteMapping("/products/{productId}")
    public ResponseEntity<ApiResponse<StagedDeletionResult>> deleteProduct(
            @PathVariable @Positive(message = "The 'productId' must be a positive number.") final Long productId) {

        log.warn("Deleting staged product {}", productId);
        StagedDeletionResult responseData = stagedDataService.deleteProduct(productId);
        ApiResponse<StagedDeletionResult> response = ApiResponse.<StagedDeletionResult>builder()
                .response(responseData)
                .displayMessage(String.format("Product deleted with %d variation(s) and %d image(s).",
                                              responseData.variationsDeleted(), responseData.imagesDeleted()))
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping("/products/{productId}/variations")
    public ResponseEntity<ApiResponse<List<StagedVariationResponse>>> listVariations(
            @PathVariable @Positive(message = "The 'productId' must be a positive number.") final Long productId) {
        return ok(stagedDataService.listVariations(productId), "Variations retrieved successfully.");
    }

    @Override
    @GetMapping("/products/{productId}/images")
    public ResponseEntity<ApiResponse<List<StagedImageResponse>>> listImages(
            @PathVariable @Positive(message = "The 'productId' must be a positive number.") final Long productId) {
        return ok(stagedDataService.listImages(productId), "Images retrieved successfully.");
    }

    // --- 3. VARIATIONS ---

    @Override
    @GetMapping("/variations/{variationId}")
    public ResponseEntity<ApiResponse<StagedVariationResponse>> getVariation(
            @PathVariable @Positive(message = "The 'variationId' must be a positive number.") final Long variationId) {
        return ok(stagedDataService.getVariation(variationId), "Variation retrieved successfully.");
    }

    @Override
    @PatchMapping("/variations/{variationId}")
    public ResponseEntity<ApiResponse<StagedVariationResponse>> updateVariation(
            @PathVariable @Positive(message = "The 'variationId' must be a positive number.") final Long variationId,
            @RequestBody @Valid final StagedVariationPatch patch) {

        log.info("Updating staged variation {}: {}", variationId, patch);
        ApiResponse<StagedVariationResponse> response = ApiResponse.<StagedVariationResponse>builder()
                .response(stagedDataService.updateVariation(variationId, patch))
                .displayMessage("Variation updated successfully.")
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @DeleteMapping("/variations/{variationId}")
    public ResponseEntity<ApiResponse<Void>> deleteVariation(
            @PathVariable @Positive(message = "The 'variationId' must be a positive number.") final Long variationId) {

        log.warn("Deleting staged variation {}", variationId);
        stagedDataService.deleteVariation(variationId);
        ApiResponse<Void> response = ApiResponse.<Void>builder()
                .displayMessage("Variation deleted.")
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }

    private static <T> ResponseEntity<ApiResponse<T>> ok(final T data, final String message) {
        return ResponseEntity.ok(ApiResponse.<T>builder()
                                            .response(data)
                                            .displayMessage(message)
                                            .showMessage(false)
                                            .statusCode(HttpStatus.OK.value())
                                            .build());
    }
}
