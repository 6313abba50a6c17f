package uk.gegc.examengine.features.exam.application;

import java.util.UUID;

/**
 * Access to the exam catalog for running sessions.
 */
public interface ExamCatalogReader {

    /**
     * Loads an exam ready to be taken.
     *
     * @throws uk.gegc.examengine.shared.exception.ResourceNotFoundException      if the exam does not exist
     * @throws uk.gegc.examengine.shared.exception.BusinessRuleViolationException if the exam has no duration or no questions
     */
    ExamDefinition getExamForSession(UUID examId);

    /**
     * Takes a row lock on the exam that is held until the caller's transaction ends.
     * Concurrent session starts on one exam queue behind it.
     *
     * @throws uk.gegc.examengine.shared.exception.ResourceNotFoundException if the exam does not exist
     */
    void lockForSessionStart(UUID examId);
}
