package com.pdm.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Predictive Maintenance Engine
 *
 * Fuses live equipment readings with OEM reference data, maintenance history
 * and fleet failure patterns into prioritised maintenance predictions.
 */
@SpringBootApplication
public class MaintenanceEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MaintenanceEngineApplication.class, args);
    }
}
