package uk.gegc.examengine.features.session.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import uk.gegc.examengine.features.exam.application.ExamCatalogReader;
import uk.gegc.examengine.features.exam.application.ExamDefinition;
import uk.gegc.examengine.features.exam.application.QuestionRef;
import uk.gegc.examengine.features.exam.domain.model.AnswerOption;
import uk.gegc.examengine.features.scoring.application.ScoreGrade;
import uk.gegc.examengine.features.scoring.application.ScoringEngine;
import uk.gegc.examengine.features.scoring.config.ScoringProperties;
import uk.gegc.examengine.features.session.api.dto.*;
import uk.gegc.examengine.features.session.application.TimerPolicy;
import uk.gegc.examengine.features.session.config.ExamSessionProperties;
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
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExamSessionServiceImpl Unit Tests")
class ExamSessionServiceImplTest {

    private static final Instant STARTED_AT = Instant.parse("2025-03-01T08:00:00Z");
    private static final int DURATION_MINUTES = 90;
    private static final long DURATION_MS = DURATION_MINUTES * 60_000L;
    private static final long GRACE_MS = 3_000L;

    @Mock
    private ExamSessionRepository sessionRepository;
    @Mock
    private ExamAnswerRepository answerRepository;
    @Mock
    private ExamCatalogReader examCatalogReader;
    @Mock
    private SessionCreator sessionCreator;

    private final ExamAnswerMapper answerMapper = Mappers.getMapper(ExamAnswerMapper.class);
    private TimerPolicy timerPolicy;
    private ScoringEngine scoringEngine;
    private ExamSessionMapper sessionMapper;

    private UUID userId;
    private UUID otherUserId;
    private UUID examId;
    private UUID sessionId;
    private QuestionRef q1;
    private QuestionRef q2;
    private QuestionRef q3;
    private ExamDefinition exam;

    @BeforeEach
    void setUp() {
        timerPolicy = new TimerPolicy(new ExamSessionProperties());
        scoringEngine = new ScoringEngine(new ScoringProperties());
        sessionMapper = new ExamSessionMapper(timerPolicy, answerMapper);

        userId = UUID.randomUUID();
        otherUserId = UUID.randomUUID();
        examId = UUID.randomUUID();
        sessionId = UUID.randomUUID();

        List<String> options = List.of("one", "two", "three", "four", "five");
        q1 = new QuestionRef(UUID.randomUUID(), 1, "A", AnswerOption.A, 10, "Question 1", options);
        q2 = new QuestionRef(UUID.randomUUID(), 2, "B", AnswerOption.B, 10, "Question 2", options);
        q3 = new QuestionRef(UUID.randomUUID(), 3, "B", AnswerOption.C, 10, "Question 3", options);
        exam = new ExamDefinition(examId, "Mock exam", DURATION_MINUTES, false, null, List.of(q1, q2, q3));
    }

    private ExamSessionServiceImpl serviceAt(Instant now) {
        return new ExamSessionServiceImpl(
                sessionRepository,
                answerRepository,
                examCatalogReader,
                scoringEngine,
                timerPolicy,
                sessionCreator,
                sessionMapper,
                answerMapper,
                Clock.fixed(now, ZoneOffset.UTC)
        );
    }

    private ExamSession session(SessionStatus status) {
        ExamSession session = new ExamSession();
        session.setId(sessionId);
        session.setUserId(userId);
        session.setExamId(examId);
        session.setAttemptNumber(1);
        session.setStatus(status);
        session.setStartedAt(STARTED_AT);
        session.setDurationMinutes(DURATION_MINUTES);
        session.setExpiresAt(STARTED_AT.plusMillis(DURATION_MS));
        session.setMaxScore(30);
        session.setQuestionCount(3);
        return session;
    }

    private ExamAnswer answer(ExamSession session, QuestionRef question, AnswerOption option) {
        ExamAnswer answer = new ExamAnswer();
        answer.setId(UUID.randomUUID());
        answer.setSession(session);
        answer.setQuestionId(question.id());
        answer.setSelectedOption(option);
        answer.setAnsweredAt(STARTED_AT.plusSeconds(60));
        return answer;
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("creates a new in-progress session with questions and empty answers")
        void start_createsNewSession() {
            // given
            ExamSession created = session(SessionStatus.IN_PROGRESS);
            when(examCatalogReader.getExamForSession(examId)).thenReturn(exam);
            when(sessionRepository.findFirstByUserIdAndExamIdOrderByAttemptNumberDesc(userId, examId))
                    .thenReturn(Optional.empty());
            when(sessionCreator.create(userId, exam, 1, STARTED_AT)).thenReturn(created);

            // when
            StartSessionResponse response = serviceAt(STARTED_AT).start(userId, examId);

            // then
            assertThat(response.resumed()).isFalse();
            assertThat(response.session().sessionId()).isEqualTo(sessionId);
            assertThat(response.session().status()).isEqualTo(SessionStatus.IN_PROGRESS);
            assertThat(response.session().remainingMs()).isEqualTo(DURATION_MS);
            assertThat(response.questions()).extracting(SessionQuestionDto::questionId)
                    .containsExactly(q1.id(), q2.id(), q3.id());
            assertThat(response.questions().get(0).options()).extracting(QuestionOptionDto::option)
                    .containsExactly(AnswerOption.A, AnswerOption.B, AnswerOption.C, AnswerOption.D, AnswerOption.E);
            assertThat(response.answers()).hasSize(3)
                    .allSatisfy(a -> assertThat(a.selectedOption()).isNull());
        }

        @Test
        @DisplayName("returns the existing in-progress session unchanged")
        void start_resumesInProgressSession() {
            // given
            ExamSession existing = session(SessionStatus.IN_PROGRESS);
            when(examCatalogReader.getExamForSession(examId)).thenReturn(exam);
            when(sessionRepository.findFirstByUserIdAndExamIdOrderByAttemptNumberDesc(userId, examId))
                    .thenReturn(Optional.of(existing));
            when(answerRepository.findBySession_Id(sessionId))
                    .thenReturn(List.of(answer(existing, q2, AnswerOption.D)));

            // when
            StartSessionResponse response = serviceAt(STARTED_AT.plusSeconds(600)).start(userId, examId);

            // then
            assertThat(response.resumed()).isTrue();
            assertThat(response.session().sessionId()).isEqualTo(sessionId);
            assertThat(response.session().answeredCount()).isEqualTo(1);
            assertThat(response.session().remainingMs()).isEqualTo(DURATION_MS - 600_000);
            assertThat(response.answers()).extracting(SavedAnswerDto::selectedOption)
                    .containsExactly(null, AnswerOption.D, null);
            verify(sessionCreator, never()).create(any(), any(), anyInt(), any());
        }

        @Test
        @DisplayName("resumes an open session committed by a concurrent start instead of rejecting it")
        void start_latestAttemptStillOpen_resumesEvenWithoutRetake() {
            // given
            ExamSession committedByOtherRequest = session(SessionStatus.IN_PROGRESS);
            when(examCatalogReader.getExamForSession(examId)).thenReturn(exam);
            when(sessionRepository.findFirstByUserIdAndExamIdOrderByAttemptNumberDesc(userId, examId))
                    .thenReturn(Optional.of(committedByOtherRequest));
            when(answerRepository.findBySession_Id(sessionId)).thenReturn(List.of());

            // when
            StartSessionResponse response = serviceAt(STARTED_AT.plusSeconds(1)).start(userId, examId);

            // then
            assertThat(response.resumed()).isTrue();
            assertThat(response.session().sessionId()).isEqualTo(sessionId);
            InOrder inOrder = inOrder(examCatalogReader, sessionRepository);
            inOrder.verify(examCatalogReader).lockForSessionStart(examId);
            inOrder.verify(sessionRepository).findFirstByUserIdAndExamIdOrderByAttemptNumberDesc(userId, examId);
            verify(sessionCreator, never()).create(any(), any(), anyInt(), any());
        }

        @Test
        @DisplayName("rejects a second attempt when retakes are off")
        void start_afterTerminal_throwsAlreadyCompleted() {
            // given
            when(examCatalogReader.getExamForSession(examId)).thenReturn(exam);
            when(sessionRepository.findFirstByUserIdAndExamIdOrderByAttemptNumberDesc(userId, examId))
                    .thenReturn(Optional.of(session(SessionStatus.FINISHED)));

            // when / then
            assertThatThrownBy(() -> serviceAt(STARTED_AT).start(userId, examId))
                    .isInstanceOf(SessionAlreadyCompletedException.class);
            verify(sessionCreator, never()).create(any(), any(), anyInt(), any());
        }

        @Test
        @DisplayName("opens the next attempt number when retakes are allowed")
        void start_withRetake_createsNextAttempt() {
            // given
            ExamDefinition retakeExam = new ExamDefinition(examId, "Mock exam", DURATION_MINUTES, true, 3, exam.questions());
            ExamSession previous = session(SessionStatus.TIMEOUT);
            previous.setAttemptNumber(2);
            ExamSession created = session(SessionStatus.IN_PROGRESS);
            created.setAttemptNumber(3);
            when(examCatalogReader.getExamForSession(examId)).thenReturn(retakeExam);
            when(sessionRepository.findFirstByUserIdAndExamIdOrderByAttemptNumberDesc(userId, examId))
                    .thenReturn(Optional.of(previous));
            when(sessionCreator.create(userId, retakeExam, 3, STARTED_AT)).thenReturn(created);

            // when
            StartSessionResponse response = serviceAt(STARTED_AT).start(userId, examId);

            // then
            assertThat(response.session().attemptNumber()).isEqualTo(3);
        }

        @Test
        @DisplayName("rejects a retake once the attempt limit is reached")
        void start_withRetakeLimitReached_throwsAlreadyCompleted() {
            // given
            ExamDefinition retakeExam = new ExamDefinition(examId, "Mock exam", DURATION_MINUTES, true, 2, exam.questions());
            ExamSession previous = session(SessionStatus.FINISHED);
            previous.setAttemptNumber(2);
            when(examCatalogReader.getExamForSession(examId)).thenReturn(retakeExam);
            when(sessionRepository.findFirstByUserIdAndExamIdOrderByAttemptNumberDesc(userId, examId))
                    .thenReturn(Optional.of(previous));

            // when / then
            assertThatThrownBy(() -> serviceAt(STARTED_AT).start(userId, examId))
                    .isInstanceOf(SessionAlreadyCompletedException.class)
                    .hasMessageContaining("Maximum of 2 attempts");
        }

        @Test
        @DisplayName("losing a concurrent insert returns the winner's session")
        void start_raceLoser_returnsWinner() {
            // given
            ExamSession winner = session(SessionStatus.IN_PROGRESS);
            when(examCatalogReader.getExamForSession(examId)).thenReturn(exam);
            when(sessionRepository.findFirstByUserIdAndExamIdOrderByAttemptNumberDesc(userId, examId))
                    .thenReturn(Optional.empty());
            when(sessionCreator.create(userId, exam, 1, STARTED_AT))
                    .thenThrow(new DataIntegrityViolationException("uk_exam_sessions_user_exam_attempt"));
            when(sessionRepository.findByUserIdAndExamIdAndAttemptNumber(userId, examId, 1))
                    .thenReturn(Optional.of(winner));
            when(answerRepository.findBySession_Id(sessionId)).thenReturn(List.of());

            // when
            StartSessionResponse response = serviceAt(STARTED_AT).start(userId, examId);

            // then
            assertThat(response.session().sessionId()).isEqualTo(sessionId);
            assertThat(response.resumed()).isTrue();
        }

        @Test
        @DisplayName("propagates catalog rule violations")
        void start_examWithoutQuestions_propagates() {
            when(examCatalogReader.getExamForSession(examId)).thenThrow(new BusinessRuleViolationException(
                    BusinessRuleViolationException.EXAM_HAS_NO_QUESTIONS, "Exam has no questions"));

            assertThatThrownBy(() -> serviceAt(STARTED_AT).start(userId, examId))
                    .isInstanceOf(BusinessRuleViolationException.class);
            verifyNoInteractions(sessionRepository, sessionCreator);
        }
    }

    @Nested
    @DisplayName("submitAnswer")
    class SubmitAnswer {

        @Test
        @DisplayName("replaces the previous selection in the same row")
        void submitAnswer_upsertsExistingRow() {
            // given
            ExamSession session = session(SessionStatus.IN_PROGRESS);
            ExamAnswer existing = answer(session, q1, AnswerOption.B);
            Instant now = STARTED_AT.plusSeconds(120);
            when(sessionRepository.findByIdForUpdate(sessionId)).thenReturn(Optional.of(session));
            when(examCatalogReader.getExamForSession(examId)).thenReturn(exam);
            when(answerRepository.findBySession_IdAndQuestionId(sessionId, q1.id())).thenReturn(Optional.of(existing));
            when(answerRepository.save(any(ExamAnswer.class))).thenAnswer(inv -> inv.getArgument(0));
            when(answerRepository.countBySession_IdAndSelectedOptionIsNotNull(sessionId)).thenReturn(1L);

            // when
            SubmitAnswerResponse response = serviceAt(now).submitAnswer(sessionId, userId, q1.id(), AnswerOption.A);

            // then
            assertThat(response.answer().answerId()).isEqualTo(existing.getId());
            assertThat(response.answer().selectedOption()).isEqualTo(AnswerOption.A);
            assertThat(response.answer().answeredAt()).isEqualTo(now);
            assertThat(response.progress()).isEqualTo(new ProgressDto(1, 3, 33));
            assertThat(existing.getIsCorrect()).isNull();
            verify(answerRepository).save(existing);
        }

        @Test
        @DisplayName("a null option clears the selection")
        void submitAnswer_nullClearsSelection() {
            // given
            ExamSession session = session(SessionStatus.IN_PROGRESS);
            ExamAnswer existing = answer(session, q2, AnswerOption.C);
            when(sessionRepository.findByIdForUpdate(sessionId)).thenReturn(Optional.of(session));
            when(examCatalogReader.getExamForSession(examId)).thenReturn(exam);
            when(answerRepository.findBySession_IdAndQuestionId(sessionId, q2.id())).thenReturn(Optional.of(existing));
            when(answerRepository.save(any(ExamAnswer.class))).thenAnswer(inv -> inv.getArgument(0));
            when(answerRepository.countBySession_IdAndSelectedOptionIsNotNull(sessionId)).thenReturn(0L);

            // when
            SubmitAnswerResponse response = serviceAt(STARTED_AT.plusSeconds(5)).submitAnswer(sessionId, userId, q2.id(), null);

            // then
            assertThat(response.answer().selectedOption()).isNull();
            assertThat(response.progress().answeredCount()).isZero();
            assertThat(response.progress().percentage()).isZero();
        }

        @Test
        @DisplayName("creates a new row for a first answer")
        void submitAnswer_insertsNewRow() {
            // given
            ExamSession session = session(SessionStatus.IN_PROGRESS);
            when(sessionRepository.findByIdForUpdate(sessionId)).thenReturn(Optional.of(session));
            when(examCatalogReader.getExamForSession(examId)).thenReturn(exam);
            when(answerRepository.findBySession_IdAndQuestionId(sessionId, q3.id())).thenReturn(Optional.empty());
            when(answerRepository.save(any(ExamAnswer.class))).thenAnswer(inv -> inv.getArgument(0));
            when(answerRepository.countBySession_IdAndSelectedOptionIsNotNull(sessionId)).thenReturn(2L);

            // when
            serviceAt(STARTED_AT.plusSeconds(30)).submitAnswer(sessionId, userId, q3.id(), AnswerOption.E);

            // then
            ArgumentCaptor<ExamAnswer> captor = ArgumentCaptor.forClass(ExamAnswer.class);
            verify(answerRepository).save(captor.capture());
            assertThat(captor.getValue().getSession()).isSameAs(session);
            assertThat(captor.getValue().getQuestionId()).isEqualTo(q3.id());
            assertThat(captor.getValue().getSelectedOption()).isEqualTo(AnswerOption.E);
        }

        @Test
        @DisplayName("rejects callers who do not own the session")
        void submitAnswer_notOwner_throwsForbidden() {
            when(sessionRepository.findByIdForUpdate(sessionId)).thenReturn(Optional.of(session(SessionStatus.IN_PROGRESS)));

            assertThatThrownBy(() -> serviceAt(STARTED_AT).submitAnswer(sessionId, otherUserId, q1.id(), AnswerOption.A))
                    .isInstanceOf(ForbiddenException.class);
            verify(answerRepository, never()).save(any());
        }

        @Test
        @DisplayName("rejects unknown sessions")
        void submitAnswer_missingSession_throwsNotFound() {
            when(sessionRepository.findByIdForUpdate(sessionId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> serviceAt(STARTED_AT).submitAnswer(sessionId, userId, q1.id(), AnswerOption.A))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("rejects questions outside the exam")
        void submitAnswer_foreignQuestion_throwsInvalidReference() {
            when(sessionRepository.findByIdForUpdate(sessionId)).thenReturn(Optional.of(session(SessionStatus.IN_PROGRESS)));
            when(examCatalogReader.getExamForSession(examId)).thenReturn(exam);
            UUID foreign = UUID.randomUUID();

            assertThatThrownBy(() -> serviceAt(STARTED_AT).submitAnswer(sessionId, userId, foreign, AnswerOption.A))
                    .isInstanceOf(InvalidQuestionReferenceException.class)
                    .hasMessageContaining(foreign.toString());
            verify(answerRepository, never()).save(any());
        }

        @Test
        @DisplayName("no answer mutation succeeds once the session is closed")
        void submitAnswer_closedSession_throwsAlreadyCompleted() {
            for (SessionStatus terminal : List.of(SessionStatus.FINISHED, SessionStatus.TIMEOUT)) {
                when(sessionRepository.findByIdForUpdate(sessionId)).thenReturn(Optional.of(session(terminal)));

                assertThatThrownBy(() -> serviceAt(STARTED_AT).submitAnswer(sessionId, userId, q1.id(), AnswerOption.A))
                        .isInstanceOf(SessionAlreadyCompletedException.class);
            }
            verify(answerRepository, never()).save(any());
        }

        @Test
        @DisplayName("past the grace period times the session out and rejects the write")
        void submitAnswer_pastGrace_timesOut() {
            // given
            Instant now = STARTED_AT.plusMillis(DURATION_MS + GRACE_MS + 1);
            when(sessionRepository.findByIdForUpdate(sessionId)).thenReturn(Optional.of(session(SessionStatus.IN_PROGRESS)));
            when(sessionRepository.timeOut(sessionId, now, SessionStatus.IN_PROGRESS, SessionStatus.TIMEOUT)).thenReturn(1);

            // when / then
            assertThatThrownBy(() -> serviceAt(now).submitAnswer(sessionId, userId, q1.id(), AnswerOption.A))
                    .isInstanceOfSatisfying(SessionExpiredException.class, e -> {
                        assertThat(e.isTimedOut()).isTrue();
                        assertThat(e.getSessionId()).isEqualTo(sessionId);
                    });
            verify(answerRepository, never()).save(any());
            verifyNoInteractions(examCatalogReader);
        }
    }

    @Nested
    @DisplayName("submitExam")
    class SubmitExam {

        @Test
        @DisplayName("scores one correct, one wrong and one unanswered question")
        void submitExam_scoresAndFinishes() {
            // given
            ExamSession session = session(SessionStatus.IN_PROGRESS);
            ExamAnswer a1 = answer(session, q1, AnswerOption.A);
            ExamAnswer a2 = answer(session, q2, AnswerOption.D);
            Instant now = STARTED_AT.plusSeconds(1_800).plusMillis(750);
            ExamSession finished = session(SessionStatus.FINISHED);
            finished.setFinishedAt(now);
            finished.setTotalScore(10);

            when(sessionRepository.findByIdForUpdate(sessionId)).thenReturn(Optional.of(session));
            when(examCatalogReader.getExamForSession(examId)).thenReturn(exam);
            when(answerRepository.findBySession_Id(sessionId)).thenReturn(List.of(a1, a2));
            when(sessionRepository.finish(sessionId, now, 10, SessionStatus.IN_PROGRESS, SessionStatus.FINISHED)).thenReturn(1);
            when(sessionRepository.findById(sessionId)).thenReturn(Optional.of(finished));

            // when
            ScoreResultDto result = serviceAt(now).submitExam(sessionId, userId);

            // then
            assertThat(result.status()).isEqualTo(SessionStatus.FINISHED);
            assertThat(result.totalScore()).isEqualTo(10);
            assertThat(result.maxScore()).isEqualTo(30);
            assertThat(result.grade()).isEqualTo(ScoreGrade.E);
            assertThat(result.durationSeconds()).isEqualTo(1_800);
            assertThat(result.answeredCount()).isEqualTo(2);
            assertThat(result.totalQuestions()).isEqualTo(3);
            assertThat(result.perCategory()).containsExactly(
                    new CategoryScoreDto("A", 10, 10, 1, 1),
                    new CategoryScoreDto("B", 0, 20, 0, 2)
            );
            assertThat(a1.getIsCorrect()).isTrue();
            assertThat(a2.getIsCorrect()).isFalse();
            verify(answerRepository).saveAll(any());
        }

        @Test
        @DisplayName("succeeds one millisecond inside the grace period")
        void submitExam_justInsideGrace_succeeds() {
            // given
            ExamSession session = session(SessionStatus.IN_PROGRESS);
            Instant now = STARTED_AT.plusMillis(DURATION_MS + GRACE_MS - 1);
            ExamSession finished = session(SessionStatus.FINISHED);
            finished.setFinishedAt(now);
            finished.setTotalScore(0);
            when(sessionRepository.findByIdForUpdate(sessionId)).thenReturn(Optional.of(session));
            when(examCatalogReader.getExamForSession(examId)).thenReturn(exam);
            when(answerRepository.findBySession_Id(sessionId)).thenReturn(List.of());
            when(sessionRepository.finish(sessionId, now, 0, SessionStatus.IN_PROGRESS, SessionStatus.FINISHED)).thenReturn(1);
            when(sessionRepository.findById(sessionId)).thenReturn(Optional.of(finished));

            // when
            ScoreResultDto result = serviceAt(now).submitExam(sessionId, userId);

            // then
            assertThat(result.status()).isEqualTo(SessionStatus.FINISHED);
            verify(sessionRepository, never()).timeOut(any(), any(), any(), any());
        }

        @Test
        @DisplayName("one millisecond past the grace period times out without a score")
        void submitExam_pastGrace_timesOutWithoutScore() {
            // given
            Instant now = STARTED_AT.plusMillis(DURATION_MS + GRACE_MS + 1);
            when(sessionRepository.findByIdForUpdate(sessionId)).thenReturn(Optional.of(session(SessionStatus.IN_PROGRESS)));
            when(sessionRepository.timeOut(sessionId, now, SessionStatus.IN_PROGRESS, SessionStatus.TIMEOUT)).thenReturn(1);

            // when / then
            assertThatThrownBy(() -> serviceAt(now).submitExam(sessionId, userId))
                    .isInstanceOf(SessionExpiredException.class);
            verify(sessionRepository, never()).finish(any(), any(), anyInt(), any(), any());
            verify(answerRepository, never()).saveAll(any());
        }

        @Test
        @DisplayName("a lost finalize race reports the session as already completed")
        void submitExam_conditionalUpdateMisses_throwsAlreadyCompleted() {
            // given
            ExamSession session = session(SessionStatus.IN_PROGRESS);
            Instant now = STARTED_AT.plusSeconds(60);
            when(sessionRepository.findByIdForUpdate(sessionId)).thenReturn(Optional.of(session));
            when(examCatalogReader.getExamForSession(examId)).thenReturn(exam);
            when(answerRepository.findBySession_Id(sessionId)).thenReturn(List.of());
            when(sessionRepository.finish(eq(sessionId), eq(now), anyInt(), eq(SessionStatus.IN_PROGRESS), eq(SessionStatus.FINISHED)))
                    .thenReturn(0);

            // when / then
            assertThatThrownBy(() -> serviceAt(now).submitExam(sessionId, userId))
                    .isInstanceOf(SessionAlreadyCompletedException.class);
            verify(sessionRepository, never()).findById(any());
        }

        @Test
        @DisplayName("a second submit on a finished session is rejected without re-scoring")
        void submitExam_finishedSession_throwsAlreadyCompleted() {
            when(sessionRepository.findByIdForUpdate(sessionId)).thenReturn(Optional.of(session(SessionStatus.FINISHED)));

            assertThatThrownBy(() -> serviceAt(STARTED_AT.plusSeconds(10)).submitExam(sessionId, userId))
                    .isInstanceOf(SessionAlreadyCompletedException.class);
            verifyNoInteractions(examCatalogReader);
        }
    }

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        @DisplayName("review before submission is a rule violation")
        void review_inProgress_throwsBusinessRuleViolation() {
            when(sessionRepository.findById(sessionId)).thenReturn(Optional.of(session(SessionStatus.IN_PROGRESS)));

            assertThatThrownBy(() -> serviceAt(STARTED_AT).getAnswersForReview(sessionId, userId))
                    .isInstanceOfSatisfying(BusinessRuleViolationException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(BusinessRuleViolationException.REVIEW_NOT_AVAILABLE));
        }

        @Test
        @DisplayName("review after submission reveals every question's key")
        void review_finished_revealsAnswers() {
            // given
            ExamSession session = session(SessionStatus.FINISHED);
            session.setFinishedAt(STARTED_AT.plusSeconds(600));
            session.setTotalScore(10);
            ExamAnswer a1 = answer(session, q1, AnswerOption.A);
            a1.setIsCorrect(true);
            ExamAnswer a2 = answer(session, q2, AnswerOption.D);
            a2.setIsCorrect(false);
            when(sessionRepository.findById(sessionId)).thenReturn(Optional.of(session));
            when(examCatalogReader.getExamForSession(examId)).thenReturn(exam);
            when(answerRepository.findBySession_Id(sessionId)).thenReturn(List.of(a1, a2));

            // when
            SessionReviewDto review = serviceAt(STARTED_AT.plusSeconds(700)).getAnswersForReview(sessionId, userId);

            // then
            assertThat(review.answers()).hasSize(3);
            assertThat(review.answers()).extracting(AnswerReviewDto::correctAnswer)
                    .containsExactly(AnswerOption.A, AnswerOption.B, AnswerOption.C);
            assertThat(review.answers()).extracting(AnswerReviewDto::isCorrect)
                    .containsExactly(true, false, false);
            assertThat(review.answers()).extracting(AnswerReviewDto::pointsEarned)
                    .containsExactly(10, 0, 0);
            assertThat(review.session().remainingMs()).isNull();
            assertThat(review.session().durationSeconds()).isEqualTo(600);
            assertThat(review.perCategory()).extracting(CategoryScoreDto::score).containsExactly(10, 0);
        }

        @Test
        @DisplayName("review of a timed-out session shows answers and keys but no score")
        void review_timedOut_hidesScore() {
            // given
            ExamSession session = session(SessionStatus.TIMEOUT);
            session.setFinishedAt(STARTED_AT.plusMillis(DURATION_MS + 60_000));
            ExamAnswer a1 = answer(session, q1, AnswerOption.A);
            ExamAnswer a2 = answer(session, q2, AnswerOption.D);
            when(sessionRepository.findById(sessionId)).thenReturn(Optional.of(session));
            when(examCatalogReader.getExamForSession(examId)).thenReturn(exam);
            when(answerRepository.findBySession_Id(sessionId)).thenReturn(List.of(a1, a2));

            // when
            SessionReviewDto review = serviceAt(STARTED_AT.plusMillis(DURATION_MS * 2)).getAnswersForReview(sessionId, userId);

            // then
            assertThat(review.session().status()).isEqualTo(SessionStatus.TIMEOUT);
            assertThat(review.session().totalScore()).isNull();
            assertThat(review.answers()).extracting(AnswerReviewDto::selectedOption)
                    .containsExactly(AnswerOption.A, AnswerOption.D, null);
            assertThat(review.answers()).extracting(AnswerReviewDto::correctAnswer)
                    .containsExactly(AnswerOption.A, AnswerOption.B, AnswerOption.C);
            assertThat(review.answers()).extracting(AnswerReviewDto::isCorrect)
                    .containsOnlyNulls();
            assertThat(review.answers()).extracting(AnswerReviewDto::pointsEarned)
                    .containsOnly(0);
            assertThat(review.perCategory()).isEmpty();
        }

        @Test
        @DisplayName("review of another user's session is forbidden")
        void review_notOwner_throwsForbidden() {
            when(sessionRepository.findById(sessionId)).thenReturn(Optional.of(session(SessionStatus.FINISHED)));

            assertThatThrownBy(() -> serviceAt(STARTED_AT).getAnswersForReview(sessionId, otherUserId))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("getSession reports remaining time for in-progress sessions")
        void getSession_inProgress_hasRemainingTime() {
            when(sessionRepository.findById(sessionId)).thenReturn(Optional.of(session(SessionStatus.IN_PROGRESS)));
            when(answerRepository.countBySession_IdAndSelectedOptionIsNotNull(sessionId)).thenReturn(2L);

            SessionDto dto = serviceAt(STARTED_AT.plusSeconds(60)).getSession(sessionId, userId);

            assertThat(dto.remainingMs()).isEqualTo(DURATION_MS - 60_000);
            assertThat(dto.durationSeconds()).isNull();
            assertThat(dto.answeredCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("listSessionsForUser attaches answered counts per session")
        void listSessionsForUser_attachesCounts() {
            // given
            ExamSession active = session(SessionStatus.IN_PROGRESS);
            ExamSession done = session(SessionStatus.FINISHED);
            done.setId(UUID.randomUUID());
            done.setFinishedAt(STARTED_AT.plusSeconds(1_000));
            Pageable pageable = PageRequest.of(0, 20);
            Page<ExamSession> page = new PageImpl<>(List.of(active, done), pageable, 2);
            when(sessionRepository.findByUserId(userId, pageable)).thenReturn(page);
            List<Object[]> counts = new ArrayList<>();
            counts.add(new Object[]{done.getId(), 3L});
            when(answerRepository.countAnsweredBySessionIds(List.of(active.getId(), done.getId()))).thenReturn(counts);

            // when
            Page<SessionDto> result = serviceAt(STARTED_AT.plusSeconds(100)).listSessionsForUser(userId, null, pageable);

            // then
            assertThat(result.getContent()).hasSize(2);
            assertThat(result.getContent().get(0).answeredCount()).isZero();
            assertThat(result.getContent().get(0).remainingMs()).isEqualTo(DURATION_MS - 100_000);
            assertThat(result.getContent().get(1).answeredCount()).isEqualTo(3);
            assertThat(result.getContent().get(1).durationSeconds()).isEqualTo(1_000);
        }

        @Test
        @DisplayName("ownerOf returns the owner or fails for unknown sessions")
        void ownerOf() {
            when(sessionRepository.findById(sessionId)).thenReturn(Optional.of(session(SessionStatus.IN_PROGRESS)));
            assertThat(serviceAt(STARTED_AT).ownerOf(sessionId)).isEqualTo(userId);

            UUID missing = UUID.randomUUID();
            when(sessionRepository.findById(missing)).thenReturn(Optional.empty());
            assertThatThrownBy(() -> serviceAt(STARTED_AT).ownerOf(missing))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("expireIfAbandoned")
    class ExpireIfAbandoned {

        @Test
        @DisplayName("times out sessions older than twice their duration")
        void expire_pastThreshold() {
            Instant now = STARTED_AT.plusMillis(2 * DURATION_MS + 1);
            when(sessionRepository.findByIdForUpdate(sessionId)).thenReturn(Optional.of(session(SessionStatus.IN_PROGRESS)));
            when(sessionRepository.timeOut(sessionId, now, SessionStatus.IN_PROGRESS, SessionStatus.TIMEOUT)).thenReturn(1);

            assertThat(serviceAt(now).expireIfAbandoned(sessionId)).isTrue();
        }

        @Test
        @DisplayName("leaves younger sessions alone")
        void expire_beforeThreshold() {
            when(sessionRepository.findByIdForUpdate(sessionId)).thenReturn(Optional.of(session(SessionStatus.IN_PROGRESS)));

            assertThat(serviceAt(STARTED_AT.plusMillis(DURATION_MS + GRACE_MS + 1)).expireIfAbandoned(sessionId)).isFalse();
            verify(sessionRepository, never()).timeOut(any(), any(), any(), any());
        }

        @Test
        @DisplayName("ignores sessions that closed in the meantime")
        void expire_alreadyClosed() {
            when(sessionRepository.findByIdForUpdate(sessionId)).thenReturn(Optional.of(session(SessionStatus.FINISHED)));

            assertThat(serviceAt(STARTED_AT.plusMillis(3 * DURATION_MS)).expireIfAbandoned(sessionId)).isFalse();
            verify(sessionRepository, never()).timeOut(any(), any(), any(), any());
        }
    }
}
