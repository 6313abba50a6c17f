package uk.gegc.examengine.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.examengine.features.exam.domain.model.AnswerOption;

import java.util.List;
import java.util.UUID;

@Schema(name = "AnswerReviewDto", description = "A question with the participant's answer and the revealed key")
public record AnswerReviewDto(
        UUID questionId,
        int orderNumber,
        String category,
        String content,
        List<QuestionOptionDto> options,
        @Schema(description = "Selected option, null when unanswered") AnswerOption selectedOption,
        AnswerOption correctAnswer,
        @Schema(description = "Null when the session timed out without being scored") Boolean isCorrect,
        @Schema(description = "Zero when the session timed out without being scored", example = "5") int pointsEarned,
        @Schema(example = "5") int pointValue
) {
}
