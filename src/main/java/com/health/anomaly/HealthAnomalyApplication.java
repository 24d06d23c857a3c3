package com.health.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HealthAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthAnomalyApplication.class, args);
    }
}
