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
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

@Tag(name = "Staged Data", description = "Review and correct parsed catalog data before it is imported.")
public interface StagedDataApi {

    @Operation(summary = "List Staged Families",
            description = "Pages through the families of a session. Without upload_id the workspace's latest completed session is used; an empty page means there is nothing to review.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Page retrieved.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Invalid offset or limit.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - Unknown upload_id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<PageResult<StagedFamilyResponse>>> listFamilies(
            @RequestHeader(value = "X-Workspace-Id", defaultValue = "default") String workspaceId,
            @Parameter(description = "Session to list; defaults to the latest completed one.")
            @RequestParam(value = "upload_id", required = false) String uploadId,
            @Parameter(description = "Row offset.", example = "0")
            @RequestParam(value = "offset", defaultValue = "0") long offset,
            @Parameter(description = "Page size; the configured default when omitted.", example = "200")
            @RequestParam(value = "limit", required = false) Integer limit);

    @Operation(summary = "List Staged Products",
            description = "Pages through the products of a session, optionally filtered by family. Session resolution is the same as for families.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Page retrieved.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Invalid offset or limit.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - Unknown upload_id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<PageResult<StagedProductResponse>>> listProducts(
            @RequestHeader(value = "X-Workspace-Id", defaultValue = "default") String workspaceId,
            @Parameter(description = "Session to list; defaults to the latest completed one.")
            @RequestParam(value = "upload_id", required = false) String uploadId,
            @Parameter(description = "Only products of this staged family.")
            @RequestParam(value = "family_id", required = false) Long familyId,
            @Parameter(description = "Row offset.", example = "0")
            @RequestParam(value = "offset", defaultValue = "0") long offset,
            @Parameter(description = "Page size; the configured default when omitted.", example = "200")
            @RequestParam(value = "limit", required = false) Integer limit);

    @Operation(summary = "Get Staged Product", description = "Returns one product with its variations and images.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Product retrieved.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<StagedProductResponse>> getProduct(@PathVariable Long productId);

    @Operation(summary = "Update Staged Product",
            description = "Applies the non-null fields of the patch. A stale 'version' is rejected with 409; edits to a session that is not under review are rejected with 403.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Product updated.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Invalid field values.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Forbidden - The session no longer accepts edits.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The product was changed concurrently.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<StagedProductResponse>> updateProduct(@PathVariable Long productId,
                                                                    @RequestBody StagedProductPatch patch);

    @Operation(summary = "Delete Staged Product",
            description = "Removes the product's variations and images and marks the product skipped so it is never imported.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Product deleted.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Forbidden - The session no longer accepts edits.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<StagedDeletionResult>> deleteProduct(@PathVariable Long productId);

    @Operation(summary = "List Product Variations")
    ResponseEntity<ApiResponse<List<StagedVariationResponse>>> listVariations(@PathVariable Long productId);

    @Operation(summary = "List Product Images")
    ResponseEntity<ApiResponse<List<StagedImageResponse>>> listImages(@PathVariable Long productId);

    @Operation(summary = "Get Staged Variation")
    ResponseEntity<ApiResponse<StagedVariationResponse>> getVariation(@PathVariable Long variationId);

    @Operation(summary = "Update Staged Variation", description = "Applies the non-null fields of the patch, with the same version and review checks as products.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Variation updated.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Forbidden - The session no longer accepts edits.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The variation was changed concurrently.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<StagedVariationResponse>> updateVariation(@PathVariable Long variationId,
                                                                        @RequestBody StagedVariationPatch patch);

    @Operation(summary = "Delete Staged Variation")
    ResponseEntity<ApiResponse<Void>> deleteVariation(@PathVariable Long variationId);
}
