package uk.gegc.examengine.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "CategoryScoreDto", description = "Score of one question category")
public record CategoryScoreDto(
        @Schema(example = "TWK") String category,
        @Schema(example = "85") int score,
        @Schema(example = "150") int maxScore,
        @Schema(example = "17") int correctCount,
        @Schema(example = "30") int totalCount
) {
}
