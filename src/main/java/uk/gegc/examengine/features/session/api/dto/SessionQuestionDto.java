package uk.gegc.examengine.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "SessionQuestionDto", description = "Question as shown to the participant, without the answer key")
public record SessionQuestionDto(
        @Schema(description = "Question UUID") UUID questionId,
        @Schema(description = "Position in the exam", example = "1") int orderNumber,
        @Schema(description = "Category", example = "TWK") String category,
        @Schema(description = "Question text") String content,
        @Schema(description = "Ordered options A to E") List<QuestionOptionDto> options
) {
}
