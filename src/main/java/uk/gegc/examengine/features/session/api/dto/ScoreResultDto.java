package uk.gegc.examengine.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.examengine.features.scoring.application.ScoreGrade;
import uk.gegc.examengine.features.session.domain.model.SessionStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "ScoreResultDto", description = "Outcome of a submitted exam session")
public record ScoreResultDto(
        @Schema(description = "Session UUID") UUID sessionId,
        @Schema(description = "Exam UUID") UUID examId,
        @Schema(description = "Owner UUID") UUID userId,
        @Schema(description = "Start time (UTC)") Instant startedAt,
        @Schema(description = "Finish time (UTC)") Instant finishedAt,
        @Schema(description = "Final status", example = "FINISHED") SessionStatus status,
        @Schema(example = "350") int totalScore,
        @Schema(example = "550") int maxScore,
        @Schema(description = "Score as a percentage of the maximum", example = "63.64") double percentage,
        @Schema(description = "Letter grade", example = "D") ScoreGrade grade,
        @Schema(description = "Whole seconds spent", example = "3120") long durationSeconds,
        @Schema(example = "104") long answeredCount,
        @Schema(example = "110") int totalQuestions,
        @Schema(description = "Breakdown per category") List<CategoryScoreDto> perCategory
) {
}
