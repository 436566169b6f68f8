package com.admissions.prediction.config;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Predictor settings, bound to the {@code model} prefix.
 *
 * <p>{@code mode=linear} evaluates the exported regression coefficients in
 * process; {@code mode=remote} forwards features to an external model runner.</p>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "model")
public class ModelProperties {

    /** "linear" or "remote". */
    @NotNull
    private String mode = "linear";

    private Linear linear = new Linear();

    private Remote remote = new Remote();

    /**
     * Coefficients of a regression trained on standard-scaled features.
     * Maps are keyed by wire feature name (GRE_Score, TOEFL_Score, ...).
     */
    @Data
    public static class Linear {
        private double intercept;
        private Map<String, Double> coefficients = new LinkedHashMap<>();
        private Map<String, Double> means = new LinkedHashMap<>();
        private Map<String, Double> scales = new LinkedHashMap<>();
    }

    @Data
    public static class Remote {
        private String baseUrl = "http://localhost:3001";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(8);
    }
}
