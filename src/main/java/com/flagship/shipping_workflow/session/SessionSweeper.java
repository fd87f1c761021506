package com.flagship.shipping_workflow.session;

import com.flagship.shipping_workflow.observability.WorkflowMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background removal of sessions that outlived their TTL.
 *
 * Expired sessions are already invisible to every store operation; this only
 * reclaims the storage.
 */
@Component
@ConditionalOnProperty(name = "workflow.session.sweeper.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SessionSweeper {

    private final SessionStore sessionStore;
    private final WorkflowMetrics metrics;

    @Scheduled(fixedRateString = "${workflow.session.sweeper.interval-ms:60000}")
    public void purgeExpiredSessions() {
        try {
            int purged = sessionStore.purgeExpired();
            if (purged > 0) {
                metrics.recordSessionsPurged(purged);
                log.info("Purged expired sessions: count={}", purged);
            }
        } catch (Exception e) {
            log.error("Error purging expired sessions", e);
        }
    }
}
