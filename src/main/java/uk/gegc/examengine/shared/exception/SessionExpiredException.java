package uk.gegc.examengine.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Thrown when a mutating call arrives after the time window plus grace period.
 * The session has been moved to TIMEOUT by the same call; it is reported apart from
 * a zero score so clients can show "time's up".
 */
@ResponseStatus(HttpStatus.GONE)
public class SessionExpiredException extends RuntimeException {

    private final UUID sessionId;
    private final Instant timedOutAt;

    public SessionExpiredException(UUID sessionId, Instant timedOutAt) {
        super("Exam session " + sessionId + " has run out of time and was closed");
        this.sessionId = sessionId;
        this.timedOutAt = timedOutAt;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public Instant getTimedOutAt() {
        return timedOutAt;
    }

    public boolean isTimedOut() {
        return true;
    }
}
