package com.smartexam.paper;

import com.smartexam.paper.config.AnalysisSettings;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AnalysisSettings.class)
public class SmartExamApplication {
    public static void main(String[] args) {
        SpringApplication.run(SmartExamApplication.class, args);
    }
}
