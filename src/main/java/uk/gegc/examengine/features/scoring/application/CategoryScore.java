package uk.gegc.examengine.features.scoring.application;

public record CategoryScore(
        String category,
        int score,
        int maxScore,
        int correctCount,
        int totalCount
) {
}
