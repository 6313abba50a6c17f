package uk.gegc.examengine.features.result.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Passing criteria applied to finished sessions. Every configured criterion must hold;
 * when none is configured no session counts as passed.
 */
@Data
@Component
@ConfigurationProperties(prefix = "exam.passing")
public class PassingGradeProperties {

    /**
     * Minimum overall percentage of the maximum score, e.g. 65.0. Optional.
     */
    private Double overallPercentage;

    /**
     * Minimum total score. Optional.
     */
    private Integer totalMinimumScore;

    /**
     * Minimum score per category, e.g. TWK=65, TIU=80, TKP=166. A category missing from a
     * session's breakdown counts as zero.
     */
    private Map<String, Integer> categoryMinimumScores = new LinkedHashMap<>();

    public boolean hasAnyCriterion() {
        return overallPercentage != null
                || totalMinimumScore != null
                || (categoryMinimumScores != null && !categoryMinimumScores.isEmpty());
    }
}
