package com.ai.tpr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.ai.tpr")
@EnableJpaRepositories(basePackages = "com.ai.tpr.repository")
@EntityScan(basePackages = "com.ai.tpr.entity")
public class TprWorkflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(TprWorkflowApplication.class, args);
    }
}
