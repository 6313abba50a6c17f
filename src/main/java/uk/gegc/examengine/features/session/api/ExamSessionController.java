package uk.gegc.examengine.features.session.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.examengine.features.access.application.ExamAccessGate;
import uk.gegc.examengine.features.session.api.dto.*;
import uk.gegc.examengine.features.session.application.ExamSessionService;
import uk.gegc.examengine.features.session.domain.model.SessionStatus;
import uk.gegc.examengine.shared.exception.ForbiddenException;
import uk.gegc.examengine.shared.security.AuthenticatedUser;

import java.util.List;
import java.util.UUID;

@Tag(name = "Exam Sessions", description = "Start, autosave, submit and review timed exam sessions")
@RestController
@RequestMapping("/api/v1/exam-sessions")
@RequiredArgsConstructor
@Validated
public class ExamSessionController {

    private final ExamSessionService sessionService;
    private final ExamAccessGate examAccessGate;

    @Operation(
            summary = "Start an exam session",
            description = "Opens a timed session for the exam, or returns the caller's in-progress session unchanged."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Session started or resumed",
                    content = @Content(schema = @Schema(implementation = StartSessionResponse.class))),
            @ApiResponse(responseCode = "403", description = "No access to the exam",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Exam not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Exam already completed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Exam has no questions or no duration",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/exams/{examId}")
    public ResponseEntity<StartSessionResponse> startSession(
            @Parameter(description = "Exam UUID", required = true) @PathVariable UUID examId,
            Authentication authentication
    ) {
        UUID userId = AuthenticatedUser.idOf(authentication);
        if (!examAccessGate.hasAccess(userId, examId)) {
            throw new ForbiddenException("You do not have access to exam " + examId);
        }
        StartSessionResponse response = sessionService.start(userId, examId);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "List my sessions", description = "Newest first, optionally filtered by status.")
    @GetMapping
    public ResponseEntity<Page<SessionDto>> listSessions(
            @Parameter(in = ParameterIn.QUERY, description = "Filter by status")
            @RequestParam(name = "status", required = false) SessionStatus status,

            @Parameter(in = ParameterIn.QUERY, description = "Page number (0-based)", example = "0")
            @Min(0) @RequestParam(name = "page", defaultValue = "0") int page,

            @Parameter(in = ParameterIn.QUERY, description = "Page size", example = "20")
            @Min(1) @Max(100) @RequestParam(name = "size", defaultValue = "20") int size,

            Authentication authentication
    ) {
        UUID userId = AuthenticatedUser.idOf(authentication);
        Page<SessionDto> result = sessionService.listSessionsForUser(
                userId,
                status,
                PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "startedAt"))
        );
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Get a session", description = "Includes remaining time while the session is in progress.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session returned"),
            @ApiResponse(responseCode = "403", description = "Not the owner",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionDto> getSession(@PathVariable UUID sessionId, Authentication authentication) {
        return ResponseEntity.ok(sessionService.getSession(sessionId, AuthenticatedUser.idOf(authentication)));
    }

    @Operation(summary = "Get session questions", description = "Ordered questions without the answer key.")
    @GetMapping("/{sessionId}/questions")
    public ResponseEntity<List<SessionQuestionDto>> getSessionQuestions(@PathVariable UUID sessionId,
                                                                        Authentication authentication) {
        return ResponseEntity.ok(sessionService.getSessionQuestions(sessionId, AuthenticatedUser.idOf(authentication)));
    }

    @Operation(
            summary = "Autosave an answer",
            description = "Saves or replaces the selection for one question. A null selectedOption clears it."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answer saved"),
            @ApiResponse(responseCode = "400", description = "Question is not part of the exam",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session already closed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "410", description = "Time is up; the session was timed out",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{sessionId}/answers")
    public ResponseEntity<SubmitAnswerResponse> submitAnswer(
            @PathVariable UUID sessionId,
            @RequestBody @Valid SubmitAnswerRequest request,
            Authentication authentication
    ) {
        SubmitAnswerResponse response = sessionService.submitAnswer(
                sessionId,
                AuthenticatedUser.idOf(authentication),
                request.questionId(),
                request.selectedOption()
        );
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Submit the exam", description = "Scores and closes the session. Never retry this call.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session scored",
                    content = @Content(schema = @Schema(implementation = ScoreResultDto.class))),
            @ApiResponse(responseCode = "409", description = "Session already closed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "410", description = "Time is up; no score is recorded",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{sessionId}/submit")
    public ResponseEntity<ScoreResultDto> submitExam(@PathVariable UUID sessionId, Authentication authentication) {
        return ResponseEntity.ok(sessionService.submitExam(sessionId, AuthenticatedUser.idOf(authentication)));
    }

    @Operation(summary = "Review a closed session", description = "Answers with the key revealed and the category breakdown.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Review returned"),
            @ApiResponse(responseCode = "422", description = "Session not submitted yet",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{sessionId}/review")
    public ResponseEntity<SessionReviewDto> getReview(@PathVariable UUID sessionId, Authentication authentication) {
        return ResponseEntity.ok(sessionService.getAnswersForReview(sessionId, AuthenticatedUser.idOf(authentication)));
    }
}
