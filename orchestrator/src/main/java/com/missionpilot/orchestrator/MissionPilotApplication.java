package com.missionpilot.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * To run:
 *   ANTHROPIC_API_KEY=sk-ant-... mvn -pl orchestrator spring-boot:run
 */
@SpringBootApplication
public class MissionPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(MissionPilotApplication.class, args);
    }
}
