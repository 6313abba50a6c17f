package uk.gegc.examengine.features.result.application.impl;

import lombok.RequiredArgsConstructor;
import uk.gegc.examengine.features.result.application.PassingPolicy;
import uk.gegc.examengine.features.result.application.SessionOutcome;
import uk.gegc.examengine.features.result.config.PassingGradeProperties;

import java.util.Map;

@RequiredArgsConstructor
public class ConfiguredPassingPolicy implements PassingPolicy {

    private final PassingGradeProperties properties;

    @Override
    public boolean isPassed(SessionOutcome outcome) {
        if (!properties.hasAnyCriterion()) {
            return false;
        }
        if (properties.getOverallPercentage() != null
                && outcome.percentage() < properties.getOverallPercentage()) {
            return false;
        }
        if (properties.getTotalMinimumScore() != null
                && outcome.totalScore() < properties.getTotalMinimumScore()) {
            return false;
        }
        if (properties.getCategoryMinimumScores() != null) {
            for (Map.Entry<String, Integer> minimum : properties.getCategoryMinimumScores().entrySet()) {
                if (outcome.categoryScore(minimum.getKey()) < minimum.getValue()) {
                    return false;
                }
            }
        }
        return true;
    }
}
