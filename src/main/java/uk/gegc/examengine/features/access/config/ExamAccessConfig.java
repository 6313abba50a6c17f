package uk.gegc.examengine.features.access.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.examengine.features.access.application.ExamAccessGate;
import uk.gegc.examengine.features.access.infra.OpenExamAccessGate;

@Configuration
public class ExamAccessConfig {

    @Bean
    @ConditionalOnMissingBean(ExamAccessGate.class)
    public ExamAccessGate examAccessGate() {
        return new OpenExamAccessGate();
    }
}
