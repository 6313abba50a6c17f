package uk.gegc.examengine.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidQuestionReferenceException extends RuntimeException {

    private final UUID questionId;

    public InvalidQuestionReferenceException(UUID questionId, UUID examId) {
        super("Question " + questionId + " is not part of exam " + examId);
        this.questionId = questionId;
    }

    public UUID getQuestionId() {
        return questionId;
    }
}
