package com.hausbesuch.planner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EntityScan(basePackages = "com.hausbesuch.planner.model")
@EnableScheduling
public class VisitPlannerApplication {
    public static void main(String[] args) {
        SpringApplication.run(VisitPlannerApplication.class, args);
    }
}
