package uk.gegc.examengine.features.session.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * One user's timed attempt at one exam.
 * Duration, deadline, question count and maximum score are copied from the catalog when the session starts.
 */
@Entity
@Getter
@Setter
@Table(name = "exam_sessions",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_exam_sessions_user_exam_attempt",
                columnNames = {"user_id", "exam_id", "attempt_number"}))
public class ExamSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "exam_id", nullable = false, updatable = false)
    private UUID examId;

    @Column(name = "attempt_number", nullable = false, updatable = false)
    private int attemptNumber = 1;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SessionStatus status;

    @Column(name = "total_score")
    private Integer totalScore;

    @Column(name = "duration_minutes", nullable = false, updatable = false)
    private int durationMinutes;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "max_score", nullable = false, updatable = false)
    private int maxScore;

    @Column(name = "question_count", nullable = false, updatable = false)
    private int questionCount;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    @Column(name = "version")
    private Long version;

    public boolean isInProgress() {
        return status == SessionStatus.IN_PROGRESS;
    }
}
