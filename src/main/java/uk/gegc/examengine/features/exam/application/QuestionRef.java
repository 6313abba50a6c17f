package uk.gegc.examengine.features.exam.application;

import uk.gegc.examengine.features.exam.domain.model.AnswerOption;

import java.util.List;
import java.util.UUID;

/**
 * Read-only projection of a catalog question as the session engine sees it.
 * {@code options} is ordered: index 0 is option A.
 */
public record QuestionRef(
        UUID id,
        int orderNumber,
        String category,
        AnswerOption correctAnswer,
        int pointValue,
        String content,
        List<String> options
) {
    public QuestionRef {
        options = options == null ? List.of() : List.copyOf(options);
    }
}
