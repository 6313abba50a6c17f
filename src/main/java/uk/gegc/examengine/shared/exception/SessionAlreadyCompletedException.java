package uk.gegc.examengine.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

/**
 * Thrown for any write against a session that already reached a terminal status,
 * and for starting an exam whose attempts are used up.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class SessionAlreadyCompletedException extends RuntimeException {

    private final UUID sessionId;

    public SessionAlreadyCompletedException(UUID sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public UUID getSessionId() {
        return sessionId;
    }
}
