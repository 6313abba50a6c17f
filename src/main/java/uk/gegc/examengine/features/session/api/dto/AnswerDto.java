package uk.gegc.examengine.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.examengine.features.exam.domain.model.AnswerOption;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "AnswerDto", description = "Stored answer row; correctness is never revealed here")
public record AnswerDto(
        @Schema(description = "Answer UUID") UUID answerId,
        @Schema(description = "Question UUID") UUID questionId,
        @Schema(description = "Selected option, null when cleared", example = "B") AnswerOption selectedOption,
        @Schema(description = "Save time (UTC)") Instant answeredAt
) {
}
