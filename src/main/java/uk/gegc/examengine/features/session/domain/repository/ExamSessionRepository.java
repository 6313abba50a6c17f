package uk.gegc.examengine.features.session.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.examengine.features.session.domain.model.ExamSession;
import uk.gegc.examengine.features.session.domain.model.SessionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExamSessionRepository extends JpaRepository<ExamSession, UUID> {

    /**
     * Loads the session holding a row lock (SELECT ... FOR UPDATE) until the transaction ends.
     * Autosaves and the final submit of one session are serialized on this lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ExamSession s WHERE s.id = :id")
    Optional<ExamSession> findByIdForUpdate(@Param("id") UUID id);

    Optional<ExamSession> findFirstByUserIdAndExamIdOrderByAttemptNumberDesc(UUID userId, UUID examId);

    Optional<ExamSession> findByUserIdAndExamIdAndAttemptNumber(UUID userId, UUID examId, int attemptNumber);

    Page<ExamSession> findByUserId(UUID userId, Pageable pageable);

    Page<ExamSession> findByUserIdAndStatus(UUID userId, SessionStatus status, Pageable pageable);

    List<ExamSession> findByUserIdAndStatus(UUID userId, SessionStatus status);

    List<ExamSession> findByStatus(SessionStatus status);

    List<ExamSession> findByExamIdAndStatus(UUID examId, SessionStatus status);

    /**
     * One batch of sessions whose deadline lies strictly between {@code after} and {@code cutoff},
     * oldest deadline first. Callers walk forward by passing the last deadline seen as {@code after}
     * and apply the abandonment threshold per session.
     */
    @Query("""
            SELECT s
            FROM ExamSession s
            WHERE s.status = :status
              AND s.expiresAt > :after
              AND s.expiresAt < :cutoff
            ORDER BY s.expiresAt ASC
            """)
    List<ExamSession> findExpiredCandidates(@Param("status") SessionStatus status,
                                            @Param("after") Instant after,
                                            @Param("cutoff") Instant cutoff,
                                            Pageable pageable);

    @Query(value = """
            SELECT s
            FROM ExamSession s
            WHERE (:examId IS NULL OR s.examId = :examId)
              AND (:userId IS NULL OR s.userId = :userId)
              AND (:status IS NULL OR s.status = :status)
            """,
            countQuery = """
                    SELECT COUNT(s)
                    FROM ExamSession s
                    WHERE (:examId IS NULL OR s.examId = :examId)
                      AND (:userId IS NULL OR s.userId = :userId)
                      AND (:status IS NULL OR s.status = :status)
                    """)
    Page<ExamSession> findAllFiltered(@Param("examId") UUID examId,
                                      @Param("userId") UUID userId,
                                      @Param("status") SessionStatus status,
                                      Pageable pageable);

    /**
     * Moves a session from {@code expected} to FINISHED with its score.
     *
     * @return 1 when this call won the transition, 0 when the session had already left {@code expected}
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE ExamSession s
            SET s.status = :finished,
                s.finishedAt = :finishedAt,
                s.totalScore = :totalScore,
                s.version = s.version + 1
            WHERE s.id = :id
              AND s.status = :expected
            """)
    int finish(@Param("id") UUID id,
               @Param("finishedAt") Instant finishedAt,
               @Param("totalScore") int totalScore,
               @Param("expected") SessionStatus expected,
               @Param("finished") SessionStatus finished);

    /**
     * Moves a session from {@code expected} to TIMEOUT without a score.
     *
     * @return number of rows changed, 0 when the session was no longer {@code expected}
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE ExamSession s
            SET s.status = :timeout,
                s.finishedAt = :finishedAt,
                s.version = s.version + 1
            WHERE s.id = :id
              AND s.status = :expected
            """)
    int timeOut(@Param("id") UUID id,
                @Param("finishedAt") Instant finishedAt,
                @Param("expected") SessionStatus expected,
                @Param("timeout") SessionStatus timeout);
}
