package uk.gegc.examengine.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ProgressDto", description = "How much of the exam has been answered")
public record ProgressDto(
        @Schema(example = "12") long answeredCount,
        @Schema(example = "110") int totalQuestions,
        @Schema(description = "Rounded percentage", example = "11") int percentage
) {
}
