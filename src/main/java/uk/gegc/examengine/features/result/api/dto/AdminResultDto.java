package uk.gegc.examengine.features.result.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.examengine.features.session.domain.model.SessionStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "AdminResultDto", description = "One exam session as listed to administrators")
public record AdminResultDto(
        UUID sessionId,
        UUID userId,
        UUID examId,
        int attemptNumber,
        SessionStatus status,
        Instant startedAt,
        Instant finishedAt,
        Instant createdAt,
        @Schema(description = "Null unless FINISHED") Integer totalScore,
        int maxScore,
        @Schema(description = "Null unless FINISHED", example = "63.64") Double percentage,
        @Schema(description = "Null unless FINISHED") Boolean passed
) {
}
