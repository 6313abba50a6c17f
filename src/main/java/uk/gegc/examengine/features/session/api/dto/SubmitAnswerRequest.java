package uk.gegc.examengine.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import uk.gegc.examengine.features.exam.domain.model.AnswerOption;

import java.util.UUID;

@Schema(name = "SubmitAnswerRequest", description = "Autosave of one answer; a null option clears a previous selection")
public record SubmitAnswerRequest(
        @Schema(description = "UUID of the question", requiredMode = Schema.RequiredMode.REQUIRED,
                example = "3fa85f64-5717-4562-b3fc-2c963f66afa6")
        @NotNull(message = "Question ID is required")
        UUID questionId,

        @Schema(description = "Selected option letter, or null to clear", example = "B", nullable = true)
        AnswerOption selectedOption
) {
}
