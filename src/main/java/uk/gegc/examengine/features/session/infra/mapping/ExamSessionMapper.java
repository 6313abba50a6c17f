package uk.gegc.examengine.features.session.infra.mapping;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.examengine.features.exam.application.QuestionRef;
import uk.gegc.examengine.features.exam.domain.model.AnswerOption;
import uk.gegc.examengine.features.scoring.application.ScorableQuestion;
import uk.gegc.examengine.features.scoring.application.ScoreBreakdown;
import uk.gegc.examengine.features.session.api.dto.*;
import uk.gegc.examengine.features.session.application.TimerPolicy;
import uk.gegc.examengine.features.session.domain.model.ExamAnswer;
import uk.gegc.examengine.features.session.domain.model.ExamSession;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.IntStream;

@Component
@RequiredArgsConstructor
public class ExamSessionMapper {

    private final TimerPolicy timerPolicy;
    private final ExamAnswerMapper answerMapper;

    public SessionDto toDto(ExamSession session, long answeredCount, Instant now) {
        Long remainingMs = session.isInProgress()
                ? timerPolicy.remainingMs(session.getStartedAt(), session.getDurationMinutes(), now)
                : null;
        Long durationSeconds = session.getFinishedAt() != null
                ? timerPolicy.elapsedSeconds(session.getStartedAt(), session.getFinishedAt())
                : null;
        return new SessionDto(
                session.getId(),
                session.getExamId(),
                session.getUserId(),
                session.getAttemptNumber(),
                session.getStatus(),
                session.getStartedAt(),
                session.getFinishedAt(),
                session.getExpiresAt(),
                session.getDurationMinutes(),
                remainingMs,
                durationSeconds,
                session.getTotalScore(),
                session.getMaxScore(),
                answeredCount,
                session.getQuestionCount()
        );
    }

    public SessionQuestionDto toQuestionDto(QuestionRef question) {
        return new SessionQuestionDto(
                question.id(),
                question.orderNumber(),
                question.category(),
                question.content(),
                toOptionDtos(question.options())
        );
    }

    /**
     * One saved-answer entry per question, in question order; unanswered questions get a null selection.
     */
    public List<SavedAnswerDto> toSavedAnswers(List<QuestionRef> questions, Map<UUID, ExamAnswer> answersByQuestion) {
        List<SavedAnswerDto> result = new ArrayList<>(questions.size());
        for (QuestionRef question : questions) {
            ExamAnswer answer = answersByQuestion.get(question.id());
            result.add(answer != null
                    ? answerMapper.toSavedDto(answer)
                    : new SavedAnswerDto(question.id(), null, null));
        }
        return result;
    }

    public ScoreResultDto toScoreResult(ExamSession session,
                                        ScoreBreakdown breakdown,
                                        long answeredCount) {
        return new ScoreResultDto(
                session.getId(),
                session.getExamId(),
                session.getUserId(),
                session.getStartedAt(),
                session.getFinishedAt(),
                session.getStatus(),
                breakdown.totalScore(),
                breakdown.maxScore(),
                breakdown.percentage(),
                breakdown.grade(),
                timerPolicy.elapsedSeconds(session.getStartedAt(), session.getFinishedAt()),
                answeredCount,
                session.getQuestionCount(),
                answerMapper.toCategoryDtos(breakdown.perCategory())
        );
    }

    public AnswerReviewDto toReviewDto(QuestionRef question, ScorableQuestion scored) {
        return new AnswerReviewDto(
                question.id(),
                question.orderNumber(),
                question.category(),
                question.content(),
                toOptionDtos(question.options()),
                scored.submittedOption(),
                question.correctAnswer(),
                scored.isCorrect(),
                scored.pointsEarned(),
                question.pointValue()
        );
    }

    public AnswerReviewDto toUnscoredReviewDto(QuestionRef question, AnswerOption submittedOption) {
        return new AnswerReviewDto(
                question.id(),
                question.orderNumber(),
                question.category(),
                question.content(),
                toOptionDtos(question.options()),
                submittedOption,
                question.correctAnswer(),
                null,
                0,
                question.pointValue()
        );
    }

    private List<QuestionOptionDto> toOptionDtos(List<String> options) {
        int count = Math.min(options.size(), AnswerOption.MAX_OPTIONS);
        return IntStream.range(0, count)
                .mapToObj(i -> new QuestionOptionDto(AnswerOption.fromIndex(i), options.get(i)))
                .toList();
    }
}
