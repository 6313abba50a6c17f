package uk.gegc.examengine.features.session.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.examengine.features.session.domain.model.ExamAnswer;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExamAnswerRepository extends JpaRepository<ExamAnswer, UUID> {

    Optional<ExamAnswer> findBySession_IdAndQuestionId(UUID sessionId, UUID questionId);

    List<ExamAnswer> findBySession_Id(UUID sessionId);

    long countBySession_IdAndSelectedOptionIsNotNull(UUID sessionId);

    @Query("""
            SELECT a.session.id, COUNT(a)
            FROM ExamAnswer a
            WHERE a.session.id IN :sessionIds
              AND a.selectedOption IS NOT NULL
            GROUP BY a.session.id
            """)
    List<Object[]> countAnsweredBySessionIds(@Param("sessionIds") Collection<UUID> sessionIds);

    @Query("""
            SELECT a
            FROM ExamAnswer a
            JOIN FETCH a.session s
            WHERE s.id IN :sessionIds
            """)
    List<ExamAnswer> findBySessionIdIn(@Param("sessionIds") Collection<UUID> sessionIds);
}
