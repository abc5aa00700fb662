package com.eyelevel.catalogingestion.controller;

import com.eyelevel.catalogingestion.dto.common.ApiResponse;
import com.eyelevel.catalogingestion.dto.importer.ProductionImportResult;
import com.eyelevel.catalogingestion.dto.upload.SessionDeletionResult;
import com.eyelevel.catalogingestion.dto.upload.UploadAcceptedResponse;
import com.eyelevel.catalogingestion.dto.upload.UploadSessionResponse;
import com.eyelevel.catalogingestion.service.importer.ProductionImporter;
import com.eyelevel.catalogingestion.service.session.UploadSessionManager;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * REST controller for the upload session lifecycle: upload, status polling, import and clear.
 * All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/uploads")
@RequiredArgsConstructor
@Validated
public class UploadSessionController implements UploadSessionApi {

    private final UploadSessionManager uploadSessionManager;
    private final ProductionImporter productionImporter;

    @Override
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<UploadAcceptedResponse>> uploadCatalog(
            @RequestHeader(value = "X-Workspace-Id", defaultValue = "default") @NotBlank(message = "The 'X-Workspace-Id' header cannot be empty.") final String workspaceId,
            @RequestPart("file") final MultipartFile file,
            @RequestParam(value = "max_pages", required = false) @Min(value = 1, message = "The 'max_pages' must be at least 1.") final Integer maxPages) {

        log.info("Received catalog upload '{}' ({} bytes) for workspace '{}', max_pages: {}",
                 file.getOriginalFilename(), file.getSize(), workspaceId, maxPages);

        UploadAcceptedResponse responseData = uploadSessionManager.createSession(workspaceId, file, maxPages);

        ApiResponse<UploadAcceptedResponse> response = ApiResponse.<UploadAcceptedResponse>builder()
                .response(responseData)
                .displayMessage(responseData.message())
                .showMessage(true)
                .statusCode(HttpStatus.ACCEPTED.value())
                .build();

        return new ResponseEntity<>(response, HttpStatus.ACCEPTED);
    }

    @Override
    @GetMapping("/recent")
    public ResponseEntity<ApiResponse<List<UploadSessionResponse>>> listRecent(
            @RequestHeader(value = "X-Workspace-Id", defaultValue = "default") final String workspaceId,
            @RequestParam(value = "limit", defaultValue = "10") @Min(value = 1, message = "The 'limit' must be at least 1.") @Max(value = 50, message = "The 'limit' cannot exceed 50.") final int limit) {

        log.debug("Listing {} recent upload session(s) for workspace '{}'", limit, workspaceId);

        ApiResponse<List<UploadSessionResponse>> response = ApiResponse.<List<UploadSessionResponse>>builder()
                .response(uploadSessionManager.listRecent(workspaceId, limit))
                .displayMessage("Recent upload sessions retrieved successfully.")
                .showMessage(false)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping("/{uploadId}/status")
    public ResponseEntity<ApiResponse<UploadSessionResponse>> getStatus(
            @PathVariable @NotBlank(message = "The 'uploadId' cannot be empty.") final String uploadId) {

        log.debug("Fetching status of upload {}", uploadId);

        ApiResponse<UploadSessionResponse> response = ApiResponse.<UploadSessionResponse>builder()
                .response(uploadSessionManager.getStatus(uploadId))
                .displayMessage("Upload status retrieved successfully.")
                .showMessage(false)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }

    @Override
    @PostMapping("/{uploadId}/import")
    public ResponseEntity<ApiResponse<ProductionImportResult>> importSession(
            @PathVariable @NotBlank(message = "The 'uploadId' cannot be empty.") final String uploadId) {

        log.info("Import requested for upload {}", uploadId);

        ProductionImportResult responseData = productionImporter.importSession(uploadId);

        ApiResponse<ProductionImportResult> response = ApiResponse.<ProductionImportResult>builder()
                .response(responseData)
                .displayMessage(String.format("Imported %d product(s) into the catalog.", responseData.productsImported()))
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }

    @Override
    @DeleteMapping("/{uploadId}")
    public ResponseEntity<ApiResponse<SessionDeletionResult>> deleteSession(
            @PathVariable @NotBlank(message = "The 'uploadId' cannot be empty.") final String uploadId) {

        log.warn("Clearing upload {}", uploadId);

        ApiResponse<SessionDeletionResult> response = ApiResponse.<SessionDeletionResult>builder()
                .response(uploadSessionManager.deleteSession(uploadId))
                .displayMessage("Upload session and its staged data were deleted.")
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }
}
