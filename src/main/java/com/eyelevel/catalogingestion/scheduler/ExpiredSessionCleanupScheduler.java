package com.eyelevel.catalogingestion.scheduler;

import com.eyelevel.catalogingestion.dto.cleanup.CleanupReport;
import com.eyelevel.catalogingestion.service.cleanup.CleanupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ExpiredSessionCleanupScheduler {

    private final CleanupService cleanupService;

    @Value("${app.scheduler.cleanup-include-orphaned:true}")
    private boolean includeOrphaned;

    @Scheduled(cron = "${app.scheduler.cleanup}")
    public void cleanupExpiredSessions() {
        log.info("Scheduled cleanup started (orphan sweep: {}).", includeOrphaned);
        final CleanupReport report = cleanupService.cleanupExpired(includeOrphaned);
        log.info("Scheduled cleanup finished: {}", report);
    }
}
