package uk.gegc.examengine.features.scoring.application;

import uk.gegc.examengine.features.exam.domain.model.AnswerOption;

import java.util.UUID;

/**
 * One exam question paired with what the participant submitted for it.
 * {@code submittedOption} is null when the question was skipped or cleared.
 */
public record ScorableQuestion(
        UUID questionId,
        String category,
        AnswerOption correctAnswer,
        int pointValue,
        AnswerOption submittedOption
) {
    public boolean isCorrect() {
        return submittedOption != null && submittedOption == correctAnswer;
    }

    public int pointsEarned() {
        return isCorrect() ? pointValue : 0;
    }
}
