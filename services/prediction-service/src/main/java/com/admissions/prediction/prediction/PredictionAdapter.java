package com.admissions.prediction.prediction;

/**
 * Black-box regression model: a validated feature record in, an estimated
 * chance of admission out.
 *
 * Implementations must be side-effect free and deterministic for a fixed
 * model. The result is expected in [0, 1] but callers clamp it anyway.
 * Failures are thrown as {@link com.admissions.prediction.exception.PredictionException};
 * an implementation never substitutes a default value.
 */
public interface PredictionAdapter {

    /**
     * Estimate the chance of admission for one applicant.
     *
     * @param record Feature record that already passed bean validation
     * @return estimated chance of admission, nominally in [0, 1]
     * @throws com.admissions.prediction.exception.PredictionException if the model cannot produce a value
     */
    double run(FeatureRecord record);
}
