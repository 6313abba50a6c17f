package uk.gegc.examengine.features.scoring.application;

import java.util.List;
import java.util.Optional;

public record ScoreBreakdown(
        int totalScore,
        int maxScore,
        int correctCount,
        List<CategoryScore> perCategory
) {
    public ScoreBreakdown {
        perCategory = List.copyOf(perCategory);
    }

    public double percentage() {
        return maxScore == 0 ? 0.0 : totalScore * 100.0 / maxScore;
    }

    public ScoreGrade grade() {
        return ScoreGrade.of(totalScore, maxScore);
    }

    public Optional<CategoryScore> category(String category) {
        return perCategory.stream()
                .filter(c -> c.category().equals(category))
                .findFirst();
    }
}
