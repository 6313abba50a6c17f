package uk.gegc.examengine.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "SessionReviewDto", description = "Full review of a closed session")
public record SessionReviewDto(
        SessionDto session,
        List<AnswerReviewDto> answers,
        List<CategoryScoreDto> perCategory
) {
}
