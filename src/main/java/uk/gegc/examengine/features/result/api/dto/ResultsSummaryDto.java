package uk.gegc.examengine.features.result.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ResultsSummaryDto", description = "Aggregate over finished exam sessions")
public record ResultsSummaryDto(
        @Schema(description = "Finished sessions counted", example = "4") long taken,
        @Schema(description = "Mean of score/maxScore as a percentage", example = "71.25") double averagePercentage,
        @Schema(description = "Sessions meeting the passing criteria", example = "3") long passed,
        @Schema(description = "passed / taken as a percentage", example = "75.0") double passRate,
        @Schema(description = "Best percentage", example = "88.5") double highestPercentage,
        @Schema(description = "Worst percentage", example = "52.0") double lowestPercentage
) {
    public static ResultsSummaryDto empty() {
        return new ResultsSummaryDto(0, 0.0, 0, 0.0, 0.0, 0.0);
    }
}
