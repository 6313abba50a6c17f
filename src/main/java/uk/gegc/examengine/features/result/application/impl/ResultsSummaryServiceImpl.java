package uk.gegc.examengine.features.result.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.examengine.features.exam.application.ExamCatalogReader;
import uk.gegc.examengine.features.exam.application.ExamDefinition;
import uk.gegc.examengine.features.exam.application.QuestionRef;
import uk.gegc.examengine.features.result.api.dto.AdminResultDto;
import uk.gegc.examengine.features.result.api.dto.ResultsSummaryDto;
import uk.gegc.examengine.features.result.application.PassingPolicy;
import uk.gegc.examengine.features.result.application.ResultsSummaryService;
import uk.gegc.examengine.features.result.application.SessionOutcome;
import uk.gegc.examengine.features.session.domain.model.ExamAnswer;
import uk.gegc.examengine.features.session.domain.model.ExamSession;
import uk.gegc.examengine.features.session.domain.model.SessionStatus;
import uk.gegc.examengine.features.session.domain.repository.ExamAnswerRepository;
import uk.gegc.examengine.features.session.domain.repository.ExamSessionRepository;
import uk.gegc.examengine.shared.exception.BusinessRuleViolationException;
import uk.gegc.examengine.shared.exception.ResourceNotFoundException;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Read-side statistics over finished sessions. Scores come from the stored totals and the
 * stored per-answer correctness; nothing is re-scored here.
 */
@Slf4j
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class ResultsSummaryServiceImpl implements ResultsSummaryService {

    private final ExamSessionRepository sessionRepository;
    private final ExamAnswerRepository answerRepository;
    private final ExamCatalogReader examCatalogReader;
    private final PassingPolicy passingPolicy;

    @Override
    public ResultsSummaryDto getResultsSummary(UUID userId) {
        return summarize(sessionRepository.findByUserIdAndStatus(userId, SessionStatus.FINISHED));
    }

    @Override
    public ResultsSummaryDto getSystemSummary(UUID examId) {
        List<ExamSession> finished = examId != null
                ? sessionRepository.findByExamIdAndStatus(examId, SessionStatus.FINISHED)
                : sessionRepository.findByStatus(SessionStatus.FINISHED);
        return summarize(finished);
    }

    @Override
    public Page<AdminResultDto> listResults(UUID examId, UUID userId, SessionStatus status, Pageable pageable) {
        Page<ExamSession> page = sessionRepository.findAllFiltered(examId, userId, status, pageable);
        List<ExamSession> finished = page.getContent().stream()
                .filter(s -> s.getStatus() == SessionStatus.FINISHED)
                .toList();
        Map<UUID, SessionOutcome> outcomes = outcomesOf(finished);
        return page.map(s -> toAdminDto(s, outcomes.get(s.getId())));
    }

    private ResultsSummaryDto summarize(List<ExamSession> finished) {
        if (finished.isEmpty()) {
            return ResultsSummaryDto.empty();
        }
        Map<UUID, SessionOutcome> outcomes = outcomesOf(finished);

        DoubleSummaryStatistics stats = outcomes.values().stream()
                .mapToDouble(SessionOutcome::percentage)
                .summaryStatistics();
        long passed = outcomes.values().stream()
                .filter(passingPolicy::isPassed)
                .count();
        long taken = stats.getCount();

        log.debug("Summarized {} finished sessions, {} passed", taken, passed);
        return new ResultsSummaryDto(
                taken,
                round2(stats.getAverage()),
                passed,
                round2(passed * 100.0 / taken),
                round2(stats.getMax()),
                round2(stats.getMin())
        );
    }

    private Map<UUID, SessionOutcome> outcomesOf(List<ExamSession> sessions) {
        if (sessions.isEmpty()) {
            return Map.of();
        }
        Map<UUID, List<ExamAnswer>> answersBySession = answerRepository
                .findBySessionIdIn(sessions.stream().map(ExamSession::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(a -> a.getSession().getId()));

        Map<UUID, Map<UUID, QuestionRef>> questionsByExam = new HashMap<>();
        Map<UUID, SessionOutcome> outcomes = new LinkedHashMap<>();
        for (ExamSession session : sessions) {
            Map<UUID, QuestionRef> questions = questionsByExam.computeIfAbsent(session.getExamId(), this::questionsOf);
            Map<String, Integer> categoryScores = new LinkedHashMap<>();
            for (ExamAnswer answer : answersBySession.getOrDefault(session.getId(), List.of())) {
                QuestionRef question = questions.get(answer.getQuestionId());
                if (question != null && Boolean.TRUE.equals(answer.getIsCorrect())) {
                    categoryScores.merge(question.category(), question.pointValue(), Integer::sum);
                }
            }
            int total = session.getTotalScore() != null ? session.getTotalScore() : 0;
            outcomes.put(session.getId(), new SessionOutcome(total, session.getMaxScore(), categoryScores));
        }
        return outcomes;
    }

    private Map<UUID, QuestionRef> questionsOf(UUID examId) {
        try {
            ExamDefinition exam = examCatalogReader.getExamForSession(examId);
            return exam.questions().stream()
                    .collect(Collectors.toMap(QuestionRef::id, q -> q));
        } catch (ResourceNotFoundException | BusinessRuleViolationException e) {
            log.warn("Exam {} is no longer readable from the catalog, category scores omitted: {}",
                    examId, e.getMessage());
            return Map.of();
        }
    }

    private AdminResultDto toAdminDto(ExamSession session, SessionOutcome outcome) {
        return new AdminResultDto(
                session.getId(),
                session.getUserId(),
                session.getExamId(),
                session.getAttemptNumber(),
                session.getStatus(),
                session.getStartedAt(),
                session.getFinishedAt(),
                session.getCreatedAt(),
                session.getTotalScore(),
                session.getMaxScore(),
                outcome != null ? round2(outcome.percentage()) : null,
                outcome != null ? passingPolicy.isPassed(outcome) : null
        );
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
