package uk.gegc.examengine.features.session.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.examengine.features.session.application.AbandonedSessionSweeper;

/**
 * Periodically times out in-progress sessions that nobody has touched for well past their deadline.
 * Disabled with exam.session.cleanup.enabled=false.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "exam.session.cleanup", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AbandonedSessionCleanupScheduler {

    private final AbandonedSessionSweeper sweeper;

    @Scheduled(fixedDelayString = "${exam.session.cleanup.fixed-delay:PT5M}",
            initialDelayString = "${exam.session.cleanup.fixed-delay:PT5M}")
    public void cleanupAbandonedSessions() {
        log.debug("Running scheduled cleanup of abandoned exam sessions");
        try {
            sweeper.expireAbandonedSessions();
        } catch (Exception e) {
            log.error("Error during scheduled cleanup of abandoned exam sessions", e);
        }
    }
}
