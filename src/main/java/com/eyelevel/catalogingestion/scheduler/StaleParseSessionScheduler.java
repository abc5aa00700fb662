package com.eyelevel.catalogingestion.scheduler;

import com.eyelevel.catalogingestion.model.UploadSession;
import com.eyelevel.catalogingestion.model.UploadStatus;
import com.eyelevel.catalogingestion.repository.UploadSessionRepository;
import com.eyelevel.catalogingestion.service.session.SessionLifecycleManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Fails upload sessions whose parse job stopped reporting, e.g. because the instance running it was
 * restarted. Without this they would stay {@code parsing} forever and never expire.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleParseSessionScheduler {

    private final UploadSessionRepository uploadSessionRepository;
    private final SessionLifecycleManager lifecycleManager;

    @Value("${app.scheduler.stale-parse-minutes}")
    private long staleThresholdMinutes;

    @Scheduled(cron = "${app.scheduler.stale-parse}")
    public void failStaleParseSessions() {
        final LocalDateTime threshold = LocalDateTime.now().minusMinutes(staleThresholdMinutes);
        log.info("Running stale parse check. Finding in-flight sessions not updated since {}.", threshold);

        final List<UploadSession> staleSessions = uploadSessionRepository.findByStatusInAndUpdatedAtBefore(
                UploadStatus.IN_FLIGHT, threshold);
        if (CollectionUtils.isEmpty(staleSessions)) {
            log.info("No stale parse sessions found.");
            return;
        }

        log.warn("Found {} stale parse session(s) to mark as FAILED.", staleSessions.size());
        int failed = 0;
        for (final UploadSession session : staleSessions) {
            try {
                if (lifecycleManager.failed(session.getUploadId(), String.format(
                        "Parsing made no progress for %d minutes after page %d of %d.", staleThresholdMinutes,
                        session.getPagesProcessed(), session.getTotalPages()))) {
                    failed++;
                }
            } catch (RuntimeException e) {
                log.error("Could not mark stale upload {} as FAILED.", session.getUploadId(), e);
            }
        }
        log.info("Finished stale parse check. Marked {} session(s) as FAILED.", failed);
    }
}
