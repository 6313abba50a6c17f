package uk.gegc.examengine.features.exam.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.examengine.features.exam.application.ExamCatalogReader;
import uk.gegc.examengine.features.exam.application.ExamDefinition;
import uk.gegc.examengine.features.exam.application.QuestionRef;
import uk.gegc.examengine.features.exam.domain.model.Exam;
import uk.gegc.examengine.features.exam.domain.model.ExamQuestion;
import uk.gegc.examengine.features.exam.domain.repository.ExamQuestionRepository;
import uk.gegc.examengine.features.exam.domain.repository.ExamRepository;
import uk.gegc.examengine.shared.exception.BusinessRuleViolationException;
import uk.gegc.examengine.shared.exception.ResourceNotFoundException;

import java.util.List;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaExamCatalogReader implements ExamCatalogReader {

    private final ExamRepository examRepository;
    private final ExamQuestionRepository questionRepository;

    @Override
    public ExamDefinition getExamForSession(UUID examId) {
        Exam exam = examRepository.findById(examId)
                .orElseThrow(() -> new ResourceNotFoundException("Exam " + examId + " not found"));

        if (exam.getDurationMinutes() == null || exam.getDurationMinutes() <= 0) {
            throw new BusinessRuleViolationException(
                    BusinessRuleViolationException.EXAM_HAS_NO_DURATION,
                    "Exam " + examId + " has no configured duration");
        }

        List<QuestionRef> questions = questionRepository.findByExamIdWithOptions(examId).stream()
                .map(this::toQuestionRef)
                .toList();
        if (questions.isEmpty()) {
            throw new BusinessRuleViolationException(
                    BusinessRuleViolationException.EXAM_HAS_NO_QUESTIONS,
                    "Exam " + examId + " has no questions");
        }

        log.debug("Loaded exam {} with {} questions", examId, questions.size());
        return new ExamDefinition(
                exam.getId(),
                exam.getTitle(),
                exam.getDurationMinutes(),
                exam.isAllowRetake(),
                exam.getMaxAttempts(),
                questions
        );
    }

    @Override
    @Transactional
    public void lockForSessionStart(UUID examId) {
        examRepository.findByIdForUpdate(examId)
                .orElseThrow(() -> new ResourceNotFoundException("Exam " + examId + " not found"));
    }

    private QuestionRef toQuestionRef(ExamQuestion question) {
        return new QuestionRef(
                question.getId(),
                question.getOrderNumber(),
                question.getCategory(),
                question.getCorrectAnswer(),
                question.getPointValue(),
                question.getContent(),
                question.getOptions()
        );
    }
}
