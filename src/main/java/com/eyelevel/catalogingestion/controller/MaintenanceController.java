package com.eyelevel.catalogingestion.controller;

import com.eyelevel.catalogingestion.dto.cleanup.CleanupReport;
import com.eyelevel.catalogingestion.dto.common.ApiResponse;
import com.eyelevel.catalogingestion.service.cleanup.CleanupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/maintenance")
@RequiredArgsConstructor
public class MaintenanceController implements MaintenanceApi {

    private final CleanupService cleanupService;

    @Override
    @PostMapping("/cleanup-expired")
    public ResponseEntity<ApiResponse<CleanupReport>> cleanupExpired(
            @RequestParam(value = "include_orphaned", defaultValue = "false") final boolean includeOrphaned) {

        log.info("Manual cleanup requested, include_orphaned: {}", includeOrphaned);
        CleanupReport report = cleanupService.cleanupExpired(includeOrphaned);

        ApiResponse<CleanupReport> response = ApiResponse.<CleanupReport>builder()
                .response(report)
                .displayMessage(String.format("Cleanup finished: %d expired session(s) reclaimed.",
                                              report.expired().getUploadsDeleted()))
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }
}
