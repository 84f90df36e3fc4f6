package com.forecastops.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RetrainOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(RetrainOrchestratorApplication.class, args);
    }
}
