package uk.gegc.examengine.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "StartSessionResponse",
        description = "Started or resumed session with its questions and any autosaved answers")
public record StartSessionResponse(
        @Schema(description = "Session state") SessionDto session,
        @Schema(description = "True when an existing in-progress session was returned") boolean resumed,
        @Schema(description = "Questions in presentation order") List<SessionQuestionDto> questions,
        @Schema(description = "One entry per question in the same order") List<SavedAnswerDto> answers
) {
}
