package uk.gegc.examengine.features.exam.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.examengine.features.exam.domain.model.ExamQuestion;

import java.util.List;
import java.util.UUID;

@Repository
public interface ExamQuestionRepository extends JpaRepository<ExamQuestion, UUID> {

    /**
     * Questions of an exam in presentation order, options fetched in the same round trip.
     */
    @Query("""
            SELECT DISTINCT q
            FROM ExamQuestion q
            LEFT JOIN FETCH q.options
            WHERE q.exam.id = :examId
            ORDER BY q.orderNumber ASC, q.id ASC
            """)
    List<ExamQuestion> findByExamIdWithOptions(@Param("examId") UUID examId);
}
