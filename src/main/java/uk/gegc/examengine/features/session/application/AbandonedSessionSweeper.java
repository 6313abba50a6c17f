package uk.gegc.examengine.features.session.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import uk.gegc.examengine.features.session.config.ExamSessionProperties;
import uk.gegc.examengine.features.session.domain.model.ExamSession;
import uk.gegc.examengine.features.session.domain.model.SessionStatus;
import uk.gegc.examengine.features.session.domain.repository.ExamSessionRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Closes sessions whose owners walked away. Each session is expired in its own transaction
 * through {@link ExamSessionService#expireIfAbandoned}, so one failure never stops the sweep.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AbandonedSessionSweeper {

    private final ExamSessionRepository sessionRepository;
    private final ExamSessionService sessionService;
    private final TimerPolicy timerPolicy;
    private final ExamSessionProperties properties;
    private final Clock clock;

    public SweepResult expireAbandonedSessions() {
        Instant now = Instant.now(clock);
        int batchSize = Math.max(1, properties.getCleanup().getBatchSize());

        int expired = 0;
        int errors = 0;
        Instant after = Instant.EPOCH;
        List<ExamSession> batch;
        do {
            // sessions sharing the boundary deadline of a full batch wait for the next sweep
            batch = sessionRepository.findExpiredCandidates(SessionStatus.IN_PROGRESS, after, now,
                    PageRequest.of(0, batchSize));
            for (ExamSession candidate : batch) {
                if (!timerPolicy.isAbandoned(candidate.getStartedAt(), candidate.getDurationMinutes(), now)) {
                    continue;
                }
                try {
                    if (sessionService.expireIfAbandoned(candidate.getId())) {
                        expired++;
                    }
                } catch (Exception e) {
                    errors++;
                    log.error("Failed to expire abandoned exam session {}", candidate.getId(), e);
                }
            }
            if (!batch.isEmpty()) {
                after = batch.get(batch.size() - 1).getExpiresAt();
            }
        } while (batch.size() == batchSize);

        if (expired > 0 || errors > 0) {
            log.info("Abandoned session sweep: {} expired, {} errors", expired, errors);
        }
        return new SweepResult(expired, errors);
    }
}
