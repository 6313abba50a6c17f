package uk.gegc.examengine.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.examengine.features.session.domain.model.SessionStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "SessionDto", description = "State of an exam session")
public record SessionDto(
        @Schema(description = "Session UUID", example = "3fa85f64-5717-4562-b3fc-2c963f66afa6")
        UUID sessionId,

        @Schema(description = "Exam UUID")
        UUID examId,

        @Schema(description = "Owner UUID")
        UUID userId,

        @Schema(description = "Attempt number, 1 for the first attempt", example = "1")
        int attemptNumber,

        @Schema(description = "Session status", example = "IN_PROGRESS")
        SessionStatus status,

        @Schema(description = "When the session started (UTC)", example = "2025-05-20T14:30:00Z")
        Instant startedAt,

        @Schema(description = "When the session finished or timed out; null while in progress")
        Instant finishedAt,

        @Schema(description = "Nominal deadline (UTC)", example = "2025-05-20T16:10:00Z")
        Instant expiresAt,

        @Schema(description = "Exam duration in minutes", example = "100")
        int durationMinutes,

        @Schema(description = "Milliseconds left before the deadline; null once the session is closed", example = "5400000")
        Long remainingMs,

        @Schema(description = "Whole seconds between start and finish; null while in progress", example = "3120")
        Long durationSeconds,

        @Schema(description = "Total score; null unless FINISHED", example = "350")
        Integer totalScore,

        @Schema(description = "Highest achievable score", example = "550")
        int maxScore,

        @Schema(description = "Questions with a selected option", example = "12")
        long answeredCount,

        @Schema(description = "Questions in the exam", example = "110")
        int totalQuestions
) {
}
