package uk.gegc.examengine.features.session.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for exam session timing and abandoned-session cleanup.
 */
@Data
@Component
@ConfigurationProperties(prefix = "exam.session")
public class ExamSessionProperties {

    /**
     * Extra time after the nominal deadline during which a save or submit is still accepted.
     * It absorbs network latency on the last call; remaining time shown to clients never includes it.
     * Default: 3 seconds
     */
    private Duration gracePeriod = Duration.ofSeconds(3);

    private Cleanup cleanup = new Cleanup();

    @Data
    public static class Cleanup {
        /**
         * Whether the scheduled sweeper runs at all.
         */
        private boolean enabled = true;

        /**
         * Delay between sweeper runs. Default: 5 minutes
         */
        private Duration fixedDelay = Duration.ofMinutes(5);

        /**
         * A session is abandoned once its age exceeds this many times its duration.
         * Default: 2.0
         */
        private double abandonFactor = 2.0;

        /**
         * Candidates loaded per query while sweeping. Default: 100
         */
        private int batchSize = 100;
    }
}
