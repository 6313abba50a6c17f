package uk.gegc.examengine.features.session.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.examengine.features.exam.domain.model.AnswerOption;

import java.util.UUID;
import java.time.Instant;

/**
 * Autosaved answer of one question in a session. {@code isCorrect} stays null until the session is submitted.
 */
@Entity
@Getter
@Setter
@Table(name = "exam_answers",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_exam_answers_session_question",
                columnNames = {"session_id", "question_id"}))
public class ExamAnswer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id", nullable = false, updatable = false)
    private ExamSession session;

    @Column(name = "question_id", nullable = false, updatable = false)
    private UUID questionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "selected_option", length = 1)
    private AnswerOption selectedOption;

    @Column(name = "answered_at", nullable = false)
    private Instant answeredAt;

    @Column(name = "is_correct")
    private Boolean isCorrect;
}
