package uk.gegc.examengine.features.exam.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public record ExamDefinition(
        UUID examId,
        String title,
        int durationMinutes,
        boolean allowRetake,
        Integer maxAttempts,
        List<QuestionRef> questions
) {
    public ExamDefinition {
        questions = List.copyOf(questions);
    }

    public Optional<QuestionRef> findQuestion(UUID questionId) {
        return questions.stream()
                .filter(q -> q.id().equals(questionId))
                .findFirst();
    }

    public int totalQuestions() {
        return questions.size();
    }

    public int maxScore() {
        return questions.stream().mapToInt(QuestionRef::pointValue).sum();
    }
}
