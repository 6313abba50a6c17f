package uk.gegc.examengine.features.session.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.examengine.features.session.config.ExamSessionProperties;

import java.time.Duration;
import java.time.Instant;

/**
 * Time arithmetic of an exam session. Every method is a pure function of its arguments
 * and the configured grace period; callers pass "now" from the injected clock.
 */
@Component
@RequiredArgsConstructor
public class TimerPolicy {

    private final ExamSessionProperties properties;

    public long durationMs(int durationMinutes) {
        return durationMinutes * 60_000L;
    }

    /**
     * Milliseconds left until the nominal deadline, never negative. The grace period is not included.
     */
    public long remainingMs(Instant startedAt, int durationMinutes, Instant now) {
        long elapsed = Duration.between(startedAt, now).toMillis();
        return Math.max(0L, durationMs(durationMinutes) - elapsed);
    }

    /**
     * True while a mutating call is still honoured: elapsed time is at most duration plus grace.
     */
    public boolean withinGrace(Instant startedAt, int durationMinutes, Instant now) {
        long elapsed = Duration.between(startedAt, now).toMillis();
        return elapsed <= durationMs(durationMinutes) + graceMs();
    }

    public long elapsedSeconds(Instant startedAt, Instant finishedAt) {
        return Math.floorDiv(Duration.between(startedAt, finishedAt).toMillis(), 1000L);
    }

    public boolean isAbandoned(Instant startedAt, int durationMinutes, Instant now) {
        long elapsed = Duration.between(startedAt, now).toMillis();
        return elapsed > properties.getCleanup().getAbandonFactor() * durationMs(durationMinutes);
    }

    public int progressPercentage(long answered, long total) {
        if (total <= 0) {
            return 0;
        }
        return (int) Math.round(answered * 100.0 / total);
    }

    public long graceMs() {
        return properties.getGracePeriod().toMillis();
    }
}
