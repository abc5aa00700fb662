package com.eyelevel.catalogingestion.controller;

import com.eyelevel.catalogingestion.dto.cleanup.CleanupReport;
import com.eyelevel.catalogingestion.dto.common.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestParam;

@Tag(name = "Maintenance", description = "Operational endpoints for reclaiming storage.")
public interface MaintenanceApi {

    @Operation(summary = "Clean Up Expired Sessions",
            description = "Expires sessions past their expiry time and deletes their staged data and files. Optionally sweeps the file store for orphaned files. Safe to call repeatedly.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Cleanup finished.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "display_message": "Cleanup finished: 1 expired session(s) reclaimed.",
                                        "response": {
                                            "expired": {
                                                "uploads_deleted": 1,
                                                "families_deleted": 2,
                                                "products_deleted": 14,
                                                "variations_deleted": 30,
                                                "images_deleted": 21,
                                                "files_deleted": 22,
                                                "errors": 0
                                            },
                                            "orphaned": {
                                                "uploads_scanned": 4,
                                                "images_scanned": 40,
                                                "orphaned_deleted": 0,
                                                "errors": 0
                                            }
                                        },
                                        "show_message": true,
                                        "status_code": 200
                                    }
                                    """)))
    })
    ResponseEntity<ApiResponse<CleanupReport>> cleanupExpired(
            @Parameter(description = "Also delete files in storage that no live session owns.")
            @RequestParam(value = "include_orphaned", defaultValue = "false") boolean includeOrphaned);
}
