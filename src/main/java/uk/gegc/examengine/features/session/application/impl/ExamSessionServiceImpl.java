package uk.gegc.examengine.features.session.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.examengine.features.exam.application.ExamCatalogReader;
import uk.gegc.examengine.features.exam.application.ExamDefinition;
import uk.gegc.examengine.features.exam.application.QuestionRef;
import uk.gegc.examengine.features.exam.domain.model.AnswerOption;
import uk.gegc.examengine.features.scoring.application.ScorableQuestion;
import uk.gegc.examengine.features.scoring.application.ScoreBreakdown;
import uk.gegc.examengine.features.scoring.application.ScoringEngine;
import uk.gegc.examengine.features.session.api.dto.*;
import uk.gegc.examengine.features.session.application.ExamSessionService;
import uk.gegc.examengine.features.session.application.TimerPolicy;
import uk.gegc.examengine.features.session.domain.model.ExamAnswer;
import uk.gegc.examengine.features.session.domain.model.ExamSession;
import uk.gegc.examengine.features.session.domain.model.SessionStatus;
import uk.gegc.examengine.features.session.domain.repository.ExamAnswerRepository;
import uk.gegc.examengine.features.session.domain.repository.ExamSessionRepository;
import uk.gegc.examengine.features.session.infra.mapping.ExamAnswerMapper;
import uk.gegc.examengine.features.session.infra.mapping.ExamSessionMapper;
import uk.gegc.examengine.shared.exception.*;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class ExamSessionServiceImpl implements ExamSessionService {

    private final ExamSessionRepository sessionRepository;
    private final ExamAnswerRepository answerRepository;
    private final ExamCatalogReader examCatalogReader;
    private final ScoringEngine scoringEngine;
    private final TimerPolicy timerPolicy;
    private final SessionCreator sessionCreator;
    private final ExamSessionMapper sessionMapper;
    private final ExamAnswerMapper answerMapper;
    private final Clock clock;

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public StartSessionResponse start(UUID userId, UUID examId) {
        ExamDefinition exam = examCatalogReader.getExamForSession(examId);
        examCatalogReader.lockForSessionStart(examId);

        // at most one session per user and exam is open, and it always carries the highest attempt number
        Optional<ExamSession> latest = sessionRepository
                .findFirstByUserIdAndExamIdOrderByAttemptNumberDesc(userId, examId);
        if (latest.isPresent() && latest.get().isInProgress()) {
            log.info("Resuming exam session {} for user {} on exam {}", latest.get().getId(), userId, examId);
            return toStartResponse(latest.get(), exam, true);
        }

        int attemptNumber = nextAttemptNumber(exam, latest);
        Instant now = Instant.now(clock);
        ExamSession session;
        boolean resumed = false;
        try {
            session = sessionCreator.create(userId, exam, attemptNumber, now);
            log.info("Started exam session {} (attempt {}) for user {} on exam {}",
                    session.getId(), attemptNumber, userId, examId);
        } catch (DataIntegrityViolationException e) {
            // a concurrent start inserted the same attempt first
            session = sessionRepository.findByUserIdAndExamIdAndAttemptNumber(userId, examId, attemptNumber)
                    .orElseThrow(() -> e);
            log.warn("Concurrent start for user {} on exam {} resolved to existing session {}",
                    userId, examId, session.getId());
            if (!session.isInProgress()) {
                throw new SessionAlreadyCompletedException(session.getId(),
                        "Exam " + examId + " has already been completed");
            }
            resumed = true;
        }
        return toStartResponse(session, exam, resumed);
    }

    @Override
    @Transactional(noRollbackFor = SessionExpiredException.class)
    public SubmitAnswerResponse submitAnswer(UUID sessionId, UUID callerId, UUID questionId, AnswerOption selectedOption) {
        ExamSession session = loadForUpdate(sessionId);
        enforceOwnership(session, callerId);
        ensureInProgress(session);
        Instant now = Instant.now(clock);
        ensureWithinGrace(session, now);

        ExamDefinition exam = examCatalogReader.getExamForSession(session.getExamId());
        if (exam.findQuestion(questionId).isEmpty()) {
            throw new InvalidQuestionReferenceException(questionId, session.getExamId());
        }

        ExamAnswer answer = answerRepository.findBySession_IdAndQuestionId(sessionId, questionId)
                .orElseGet(() -> {
                    ExamAnswer created = new ExamAnswer();
                    created.setSession(session);
                    created.setQuestionId(questionId);
                    return created;
                });
        answer.setSelectedOption(selectedOption);
        answer.setAnsweredAt(now);
        answer = answerRepository.save(answer);

        long answered = answerRepository.countBySession_IdAndSelectedOptionIsNotNull(sessionId);
        int total = exam.totalQuestions();
        ProgressDto progress = new ProgressDto(answered, total, timerPolicy.progressPercentage(answered, total));
        return new SubmitAnswerResponse(answerMapper.toDto(answer), progress);
    }

    @Override
    @Transactional(noRollbackFor = SessionExpiredException.class)
    public ScoreResultDto submitExam(UUID sessionId, UUID callerId) {
        ExamSession session = loadForUpdate(sessionId);
        enforceOwnership(session, callerId);
        ensureInProgress(session);
        Instant now = Instant.now(clock);
        ensureWithinGrace(session, now);

        ExamDefinition exam = examCatalogReader.getExamForSession(session.getExamId());
        Map<UUID, ExamAnswer> answers = answersByQuestion(sessionId);
        List<ScorableQuestion> scorables = toScorables(exam, answers);
        ScoreBreakdown breakdown = scoringEngine.score(scorables);

        for (ScorableQuestion scored : scorables) {
            ExamAnswer answer = answers.get(scored.questionId());
            if (answer != null) {
                answer.setIsCorrect(scored.isCorrect());
            }
        }
        answerRepository.saveAll(answers.values());

        int updated = sessionRepository.finish(sessionId, now, breakdown.totalScore(),
                SessionStatus.IN_PROGRESS, SessionStatus.FINISHED);
        if (updated == 0) {
            throw new SessionAlreadyCompletedException(sessionId, "Exam session " + sessionId + " was already submitted");
        }

        log.info("Exam session {} finished with score {}/{}", sessionId, breakdown.totalScore(), breakdown.maxScore());
        log.debug("Category breakdown for session {}: {}", sessionId, breakdown.perCategory());

        ExamSession finished = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new IllegalStateException("Exam session " + sessionId + " vanished after submit"));
        long answeredCount = answers.values().stream()
                .filter(a -> a.getSelectedOption() != null)
                .count();
        return sessionMapper.toScoreResult(finished, breakdown, answeredCount);
    }

    @Override
    @Transactional(readOnly = true)
    public SessionDto getSession(UUID sessionId, UUID callerId) {
        ExamSession session = loadSession(sessionId);
        enforceOwnership(session, callerId);
        long answered = answerRepository.countBySession_IdAndSelectedOptionIsNotNull(sessionId);
        return sessionMapper.toDto(session, answered, Instant.now(clock));
    }

    @Override
    @Transactional(readOnly = true)
    public List<SessionQuestionDto> getSessionQuestions(UUID sessionId, UUID callerId) {
        ExamSession session = loadSession(sessionId);
        enforceOwnership(session, callerId);
        ExamDefinition exam = examCatalogReader.getExamForSession(session.getExamId());
        return exam.questions().stream()
                .map(sessionMapper::toQuestionDto)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public SessionReviewDto getAnswersForReview(UUID sessionId, UUID callerId) {
        ExamSession session = loadSession(sessionId);
        enforceOwnership(session, callerId);
        if (session.isInProgress()) {
            throw new BusinessRuleViolationException(
                    BusinessRuleViolationException.REVIEW_NOT_AVAILABLE,
                    "Review is unavailable before the exam is submitted");
        }

        ExamDefinition exam = examCatalogReader.getExamForSession(session.getExamId());
        Map<UUID, ExamAnswer> answers = answersByQuestion(sessionId);
        List<ScorableQuestion> scorables = toScorables(exam, answers);
        long answered = answers.values().stream().filter(a -> a.getSelectedOption() != null).count();
        SessionDto sessionDto = sessionMapper.toDto(session, answered, Instant.now(clock));

        // a timed-out session was never scored, so correctness and points stay hidden
        boolean scored = session.getStatus() == SessionStatus.FINISHED;
        List<AnswerReviewDto> reviewed = new ArrayList<>(scorables.size());
        for (int i = 0; i < scorables.size(); i++) {
            QuestionRef question = exam.questions().get(i);
            reviewed.add(scored
                    ? sessionMapper.toReviewDto(question, scorables.get(i))
                    : sessionMapper.toUnscoredReviewDto(question, scorables.get(i).submittedOption()));
        }
        if (!scored) {
            return new SessionReviewDto(sessionDto, reviewed, List.of());
        }
        ScoreBreakdown breakdown = scoringEngine.score(scorables);
        return new SessionReviewDto(sessionDto, reviewed, answerMapper.toCategoryDtos(breakdown.perCategory()));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<SessionDto> listSessionsForUser(UUID userId, SessionStatus status, Pageable pageable) {
        Page<ExamSession> page = status != null
                ? sessionRepository.findByUserIdAndStatus(userId, status, pageable)
                : sessionRepository.findByUserId(userId, pageable);

        Map<UUID, Long> answeredCounts = new HashMap<>();
        if (page.hasContent()) {
            List<UUID> ids = page.getContent().stream().map(ExamSession::getId).toList();
            for (Object[] row : answerRepository.countAnsweredBySessionIds(ids)) {
                answeredCounts.put((UUID) row[0], ((Number) row[1]).longValue());
            }
        }
        Instant now = Instant.now(clock);
        return page.map(s -> sessionMapper.toDto(s, answeredCounts.getOrDefault(s.getId(), 0L), now));
    }

    @Override
    @Transactional(readOnly = true)
    public UUID ownerOf(UUID sessionId) {
        return loadSession(sessionId).getUserId();
    }

    @Override
    public boolean expireIfAbandoned(UUID sessionId) {
        ExamSession session = loadForUpdate(sessionId);
        if (!session.getStatus().canTransitionTo(SessionStatus.TIMEOUT)) {
            return false;
        }
        Instant now = Instant.now(clock);
        if (!timerPolicy.isAbandoned(session.getStartedAt(), session.getDurationMinutes(), now)) {
            return false;
        }
        int updated = sessionRepository.timeOut(sessionId, now, SessionStatus.IN_PROGRESS, SessionStatus.TIMEOUT);
        if (updated == 1) {
            log.info("Abandoned exam session {} of user {} timed out", sessionId, session.getUserId());
        }
        return updated == 1;
    }

    private int nextAttemptNumber(ExamDefinition exam, Optional<ExamSession> latest) {
        if (latest.isEmpty()) {
            return 1;
        }
        ExamSession last = latest.get();
        if (!exam.allowRetake()) {
            throw new SessionAlreadyCompletedException(last.getId(),
                    "Exam " + exam.examId() + " has already been completed");
        }
        if (exam.maxAttempts() != null && last.getAttemptNumber() >= exam.maxAttempts()) {
            throw new SessionAlreadyCompletedException(last.getId(),
                    "Maximum of " + exam.maxAttempts() + " attempts reached for exam " + exam.examId());
        }
        return last.getAttemptNumber() + 1;
    }

    private StartSessionResponse toStartResponse(ExamSession session, ExamDefinition exam, boolean resumed) {
        Map<UUID, ExamAnswer> answers = resumed ? answersByQuestion(session.getId()) : Map.of();
        long answered = answers.values().stream().filter(a -> a.getSelectedOption() != null).count();
        List<SessionQuestionDto> questions = exam.questions().stream()
                .map(sessionMapper::toQuestionDto)
                .toList();
        return new StartSessionResponse(
                sessionMapper.toDto(session, answered, Instant.now(clock)),
                resumed,
                questions,
                sessionMapper.toSavedAnswers(exam.questions(), answers)
        );
    }

    private List<ScorableQuestion> toScorables(ExamDefinition exam, Map<UUID, ExamAnswer> answers) {
        List<ScorableQuestion> scorables = new ArrayList<>(exam.totalQuestions());
        for (QuestionRef question : exam.questions()) {
            ExamAnswer answer = answers.get(question.id());
            scorables.add(new ScorableQuestion(
                    question.id(),
                    question.category(),
                    question.correctAnswer(),
                    question.pointValue(),
                    answer != null ? answer.getSelectedOption() : null
            ));
        }
        return scorables;
    }

    private Map<UUID, ExamAnswer> answersByQuestion(UUID sessionId) {
        return answerRepository.findBySession_Id(sessionId).stream()
                .collect(Collectors.toMap(ExamAnswer::getQuestionId, Function.identity(), (a, b) -> a));
    }

    private ExamSession loadSession(UUID sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Exam session " + sessionId + " not found"));
    }

    private ExamSession loadForUpdate(UUID sessionId) {
        return sessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Exam session " + sessionId + " not found"));
    }

    private void enforceOwnership(ExamSession session, UUID callerId) {
        if (!session.getUserId().equals(callerId)) {
            throw new ForbiddenException("You do not have access to exam session " + session.getId());
        }
    }

    private void ensureInProgress(ExamSession session) {
        if (session.getStatus().isTerminal()) {
            throw new SessionAlreadyCompletedException(session.getId(),
                    "Exam session " + session.getId() + " is already " + session.getStatus());
        }
    }

    /**
     * Past the grace window the session is moved to TIMEOUT here; the transition commits
     * even though the call fails.
     */
    private void ensureWithinGrace(ExamSession session, Instant now) {
        if (timerPolicy.withinGrace(session.getStartedAt(), session.getDurationMinutes(), now)) {
            return;
        }
        int updated = sessionRepository.timeOut(session.getId(), now, SessionStatus.IN_PROGRESS, SessionStatus.TIMEOUT);
        if (updated == 0) {
            throw new SessionAlreadyCompletedException(session.getId(),
                    "Exam session " + session.getId() + " is already closed");
        }
        log.warn("Exam session {} of user {} ran past its grace period and was timed out",
                session.getId(), session.getUserId());
        throw new SessionExpiredException(session.getId(), now);
    }
}
