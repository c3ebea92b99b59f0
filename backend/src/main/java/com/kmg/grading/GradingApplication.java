package com.kmg.grading;

import com.kmg.grading.config.GradingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(GradingProperties.class)
public class GradingApplication {
    public static void main(String[] args) {
        SpringApplication.run(GradingApplication.class, args);
    }
}
