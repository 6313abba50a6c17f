package uk.gegc.examengine.features.result.application;

import java.util.Map;

/**
 * Scored facts about one finished session that a {@link PassingPolicy} decides on.
 */
public record SessionOutcome(
        int totalScore,
        int maxScore,
        Map<String, Integer> categoryScores
) {
    public SessionOutcome {
        categoryScores = categoryScores == null ? Map.of() : Map.copyOf(categoryScores);
    }

    public double percentage() {
        return maxScore == 0 ? 0.0 : totalScore * 100.0 / maxScore;
    }

    public int categoryScore(String category) {
        return categoryScores.getOrDefault(category, 0);
    }
}
