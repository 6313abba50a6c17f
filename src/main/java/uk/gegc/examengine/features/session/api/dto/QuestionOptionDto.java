package uk.gegc.examengine.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.examengine.features.exam.domain.model.AnswerOption;

@Schema(name = "QuestionOptionDto", description = "One choice of a multiple-choice question")
public record QuestionOptionDto(
        @Schema(description = "Option letter", example = "A") AnswerOption option,
        @Schema(description = "Option text", example = "Pancasila") String text
) {
}
