package uk.gegc.examengine.features.session.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.examengine.features.exam.domain.model.AnswerOption;
import uk.gegc.examengine.features.session.api.dto.*;
import uk.gegc.examengine.features.session.domain.model.SessionStatus;

import java.util.List;
import java.util.UUID;

public interface ExamSessionService extends SessionOwnershipLookup {

    /**
     * Starts a session, or returns the caller's in-progress session for the exam unchanged.
     */
    StartSessionResponse start(UUID userId, UUID examId);

    /**
     * Saves or replaces the selection for one question. A null option clears it.
     */
    SubmitAnswerResponse submitAnswer(UUID sessionId, UUID callerId, UUID questionId, AnswerOption selectedOption);

    /**
     * Scores the session and closes it. Runs at most once per session.
     */
    ScoreResultDto submitExam(UUID sessionId, UUID callerId);

    SessionDto getSession(UUID sessionId, UUID callerId);

    List<SessionQuestionDto> getSessionQuestions(UUID sessionId, UUID callerId);

    SessionReviewDto getAnswersForReview(UUID sessionId, UUID callerId);

    Page<SessionDto> listSessionsForUser(UUID userId, SessionStatus status, Pageable pageable);

    /**
     * Times the session out if it is still in progress and older than the abandonment threshold.
     *
     * @return true when this call closed the session
     */
    boolean expireIfAbandoned(UUID sessionId);
}
