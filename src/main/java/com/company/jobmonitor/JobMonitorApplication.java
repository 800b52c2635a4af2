package com.company.jobmonitor;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@OpenAPIDefinition(
        info = @Info(
                title = "Job Schedule Monitor API",
                version = "1.0.0",
                description = "Verifies that Jenkins jobs run on their expected cron schedule"
        )
)
public class JobMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobMonitorApplication.class, args);
    }
}
