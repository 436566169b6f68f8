package com.admissions.prediction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * PredictionServiceApplication - Entry point for the admissions prediction service.
 *
 * This Spring Boot application exposes three endpoints:
 * - POST /login    - Exchange a username/password for a short-lived JWT
 * - POST /predict  - Predict the chance of admission (requires Bearer token)
 * - GET  /health   - Liveness check
 *
 * All process-wide settings (signing secret, token lifetime, credential table,
 * model coefficients) are bound once at startup from application.yml into
 * immutable @ConfigurationProperties beans. Invalid settings abort startup.
 *
 * @see com.admissions.prediction.service.AuthGate for the authentication core
 * @see com.admissions.prediction.service.PredictionService for prediction orchestration
 */
@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.admissions.prediction.config")
public class PredictionServiceApplication {

    /**
     * Application entry point.
     *
     * @param args Command-line arguments (supports standard Spring Boot args)
     */
    public static void main(String[] args) {
        SpringApplication.run(PredictionServiceApplication.class, args);
    }
}
