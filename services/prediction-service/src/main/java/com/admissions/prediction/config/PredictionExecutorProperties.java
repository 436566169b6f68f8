package com.admissions.prediction.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Thread pool sizing for predictor calls, bound to {@code prediction.executor}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "prediction.executor")
public class PredictionExecutorProperties {

    @Min(1)
    private int corePoolSize = 4;

    @Min(1)
    private int maxPoolSize = 16;

    @Min(0)
    private int queueCapacity = 200;
}
