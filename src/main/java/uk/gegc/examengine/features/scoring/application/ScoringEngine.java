package uk.gegc.examengine.features.scoring.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.examengine.features.scoring.config.ScoringProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes totals and the per-category breakdown of an exam.
 * <p>
 * No partial credit and no negative marking: a question earns its full point value when the
 * submitted option equals the key, nothing otherwise. The result depends only on the input.
 */
@Service
@RequiredArgsConstructor
public class ScoringEngine {

    private final ScoringProperties scoringProperties;

    public ScoreBreakdown score(List<ScorableQuestion> questions) {
        return score(questions, scoringProperties.getCategories());
    }

    public ScoreBreakdown score(List<ScorableQuestion> questions, List<String> declaredCategories) {
        Map<String, Tally> tallies = new LinkedHashMap<>();
        if (declaredCategories != null) {
            declaredCategories.forEach(category -> tallies.put(category, new Tally()));
        }

        int total = 0;
        int max = 0;
        int correct = 0;
        for (ScorableQuestion question : questions) {
            Tally tally = tallies.computeIfAbsent(question.category(), c -> new Tally());
            tally.maxScore += question.pointValue();
            tally.totalCount++;
            max += question.pointValue();
            if (question.isCorrect()) {
                tally.score += question.pointValue();
                tally.correctCount++;
                total += question.pointValue();
                correct++;
            }
        }

        List<CategoryScore> perCategory = new ArrayList<>(tallies.size());
        tallies.forEach((category, t) ->
                perCategory.add(new CategoryScore(category, t.score, t.maxScore, t.correctCount, t.totalCount)));
        return new ScoreBreakdown(total, max, correct, perCategory);
    }

    private static final class Tally {
        private int score;
        private int maxScore;
        private int correctCount;
        private int totalCount;
    }
}
