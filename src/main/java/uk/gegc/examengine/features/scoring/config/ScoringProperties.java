package uk.gegc.examengine.features.scoring.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Score breakdown settings.
 */
@Data
@Component
@ConfigurationProperties(prefix = "exam.scoring")
public class ScoringProperties {

    /**
     * Categories that always appear in a breakdown, in this order, even when the exam
     * has no question in them. Categories not listed here follow in order of first appearance.
     */
    private List<String> categories = new ArrayList<>();
}
