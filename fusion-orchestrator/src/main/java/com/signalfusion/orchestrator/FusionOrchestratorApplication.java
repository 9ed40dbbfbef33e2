package com.signalfusion.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FusionOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(FusionOrchestratorApplication.class, args);
    }
}
