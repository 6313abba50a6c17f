package uk.gegc.examengine.features.exam.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "exams")
public class Exam {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Column(name = "allow_retake", nullable = false)
    private boolean allowRetake = false;

    @Column(name = "max_attempts")
    private Integer maxAttempts;

    @OneToMany(mappedBy = "exam", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("orderNumber ASC")
    private List<ExamQuestion> questions = new ArrayList<>();

    public void addQuestion(ExamQuestion question) {
        question.setExam(this);
        questions.add(question);
    }
}
