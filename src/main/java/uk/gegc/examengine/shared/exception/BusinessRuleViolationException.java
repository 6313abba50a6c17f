package uk.gegc.examengine.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * A request that is well-formed but breaks an exam rule, e.g. starting an exam without
 * questions or asking for a review before the session was submitted.
 */
@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class BusinessRuleViolationException extends RuntimeException {

    public static final String EXAM_HAS_NO_QUESTIONS = "EXAM_HAS_NO_QUESTIONS";
    public static final String EXAM_HAS_NO_DURATION = "EXAM_HAS_NO_DURATION";
    public static final String REVIEW_NOT_AVAILABLE = "REVIEW_NOT_AVAILABLE";

    private final String errorCode;

    public BusinessRuleViolationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
