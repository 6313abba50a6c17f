package uk.gegc.examengine.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.examengine.features.exam.domain.model.AnswerOption;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "SavedAnswerDto", description = "Autosaved selection for one question; selectedOption is null when unanswered")
public record SavedAnswerDto(
        @Schema(description = "Question UUID") UUID questionId,
        @Schema(description = "Selected option", example = "C") AnswerOption selectedOption,
        @Schema(description = "Last save time; null when never saved") Instant answeredAt
) {
}
