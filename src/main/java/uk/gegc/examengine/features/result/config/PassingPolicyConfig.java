package uk.gegc.examengine.features.result.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.examengine.features.result.application.PassingPolicy;
import uk.gegc.examengine.features.result.application.impl.ConfiguredPassingPolicy;

@Configuration
public class PassingPolicyConfig {

    @Bean
    @ConditionalOnMissingBean(PassingPolicy.class)
    public PassingPolicy passingPolicy(PassingGradeProperties properties) {
        return new ConfiguredPassingPolicy(properties);
    }
}
