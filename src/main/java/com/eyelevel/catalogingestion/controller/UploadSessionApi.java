package com.eyelevel.catalogingestion.controller;

import com.eyelevel.catalogingestion.dto.common.ApiResponse;
import com.eyelevel.catalogingestion.dto.importer.ProductionImportResult;
import com.eyelevel.catalogingestion.dto.upload.SessionDeletionResult;
import com.eyelevel.catalogingestion.dto.upload.UploadAcceptedResponse;
import com.eyelevel.catalogingestion.dto.upload.UploadSessionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@Tag(name = "Upload Sessions", description = "Upload a catalog PDF, follow its parse, and import or clear the staged result.")
public interface UploadSessionApi {

    @Operation(summary = "Upload Catalog",
            description = "Stores the PDF, creates an upload session and starts parsing it in the background. Poll the status endpoint with the returned upload_id.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Upload accepted and parsing started.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Accepted", value = """
                                    {
                                        "display_message": "Upload accepted. Parsing started in the background.",
                                        "response": {
                                            "upload_id": "0b6f2a52-7c1e-4e8a-9d43-2f0f0c1f7a11",
                                            "status": "parsing",
                                            "message": "Upload accepted. Parsing started in the background."
                                        },
                                        "show_message": true,
                                        "status_code": 202
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Not a PDF, empty file or invalid max_pages.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "500", description = "Internal Server Error - The file could not be stored.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UploadAcceptedResponse>> uploadCatalog(
            @Parameter(description = "Workspace the upload belongs to.", example = "default")
            @RequestHeader(value = "X-Workspace-Id", defaultValue = "default") String workspaceId,
            @Parameter(description = "The catalog PDF.", required = true)
            @RequestPart("file") MultipartFile file,
            @Parameter(description = "Optional cap on the number of pages to parse.", example = "25")
            @RequestParam(value = "max_pages", required = false) Integer maxPages);

    @Operation(summary = "List Recent Sessions", description = "Returns the workspace's most recent upload sessions, newest first.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Sessions retrieved.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - limit outside 1..50.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<List<UploadSessionResponse>>> listRecent(
            @Parameter(description = "Workspace to list.", example = "default")
            @RequestHeader(value = "X-Workspace-Id", defaultValue = "default") String workspaceId,
            @Parameter(description = "Number of sessions to return.", example = "10")
            @RequestParam(value = "limit", defaultValue = "10") int limit);

    @Operation(summary = "Get Session Status",
            description = "Returns the session snapshot, including progress counters while parsing and the error message after a failure.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Status retrieved.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No session with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UploadSessionResponse>> getStatus(
            @Parameter(description = "The upload session id.", required = true)
            @PathVariable String uploadId);

    @Operation(summary = "Import Session",
            description = "Copies the reviewed session into the production catalog in one transaction. Only sessions in 'completed' can be imported.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Session imported.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No session with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The session is not in 'completed'.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ProductionImportResult>> importSession(
            @Parameter(description = "The upload session id.", required = true)
            @PathVariable String uploadId);

    @Operation(summary = "Clear Session", description = "Deletes the session, its staged rows and its files.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Session deleted.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No session with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<SessionDeletionResult>> deleteSession(
            @Parameter(description = "The upload session id.", required = true)
            @PathVariable String uploadId);
}
