package com.triagesentinel.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Triage Sentinel Analysis Engine.
 *
 * <p>
 * Spring Boot application that drains the shared file-backed job queue,
 * unpacks nested archives inside bounded scratch workspaces, scores every
 * artifact with signature, executable and indicator analysis, and renders
 * a report per job. Each poller can be switched on or off independently so
 * the producer, the analyzer and the reporter may run as separate processes.
 * </p>
 *
 * @author Naveed Gung
 */
@SpringBootApplication
@EnableScheduling
public class AnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalyzerApplication.class, args);
    }
}
