package com.draftsmith.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Draftsmith orchestrator: segments submitted documents and runs each segment
 * through the stages of its processing mode, with bounded concurrency, live
 * progress events and resumable failures.
 *
 * To run:
 *   DRAFTSMITH_LLM_API_KEY=... mvn spring-boot:run
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
