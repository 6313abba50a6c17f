package uk.gegc.examengine.features.session.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.examengine.features.exam.application.ExamDefinition;
import uk.gegc.examengine.features.session.domain.model.ExamSession;
import uk.gegc.examengine.features.session.domain.model.SessionStatus;
import uk.gegc.examengine.features.session.domain.repository.ExamSessionRepository;

import java.time.Instant;
import java.util.UUID;

/**
 * Inserts new sessions in their own transaction. A unique-key violation
 * ({@link org.springframework.dao.DataIntegrityViolationException}) rolls back only this insert
 * and leaves the caller's transaction usable for re-reading the row that won.
 */
@Component
@RequiredArgsConstructor
class SessionCreator {

    private final ExamSessionRepository sessionRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ExamSession create(UUID userId, ExamDefinition exam, int attemptNumber, Instant now) {
        ExamSession session = new ExamSession();
        session.setUserId(userId);
        session.setExamId(exam.examId());
        session.setAttemptNumber(attemptNumber);
        session.setStatus(SessionStatus.IN_PROGRESS);
        session.setStartedAt(now);
        session.setDurationMinutes(exam.durationMinutes());
        session.setExpiresAt(now.plusSeconds(exam.durationMinutes() * 60L));
        session.setMaxScore(exam.maxScore());
        session.setQuestionCount(exam.totalQuestions());
        return sessionRepository.saveAndFlush(session);
    }
}
