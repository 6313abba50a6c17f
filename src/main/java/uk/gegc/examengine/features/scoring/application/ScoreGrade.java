package uk.gegc.examengine.features.scoring.application;

public enum ScoreGrade {
    A, B, C, D, E;

    public static ScoreGrade of(int score, int maxScore) {
        if (maxScore <= 0) {
            return E;
        }
        double percentage = score * 100.0 / maxScore;
        if (percentage >= 90) {
            return A;
        }
        if (percentage >= 80) {
            return B;
        }
        if (percentage >= 70) {
            return C;
        }
        if (percentage >= 60) {
            return D;
        }
        return E;
    }
}
