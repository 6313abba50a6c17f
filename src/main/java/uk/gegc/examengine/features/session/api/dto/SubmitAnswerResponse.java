package uk.gegc.examengine.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "SubmitAnswerResponse")
public record SubmitAnswerResponse(
        AnswerDto answer,
        ProgressDto progress
) {
}
