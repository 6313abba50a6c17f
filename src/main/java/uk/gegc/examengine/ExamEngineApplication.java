package uk.gegc.examengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ExamEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExamEngineApplication.class, args);
    }

}
