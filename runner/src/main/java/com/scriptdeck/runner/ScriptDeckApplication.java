package com.scriptdeck.runner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Script runner: starts operator scripts as jobs, records their transcripts
 * and streams progress to live viewers over WebSocket.
 *
 * To run:
 *   mvn -pl runner spring-boot:run
 */
@SpringBootApplication
@EnableScheduling
public class ScriptDeckApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScriptDeckApplication.class, args);
    }
}
