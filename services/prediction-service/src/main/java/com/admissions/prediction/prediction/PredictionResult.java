package com.admissions.prediction.prediction;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Response of POST /predict: {"chance_of_admit": 0.93}
 */
@Value
public class PredictionResult {

    /** Estimated chance of admission, always within [0, 1]. */
    @JsonProperty("chance_of_admit")
    double chanceOfAdmit;
}
