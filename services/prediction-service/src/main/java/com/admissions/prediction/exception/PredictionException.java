package com.admissions.prediction.exception;

/**
 * The predictor could not produce a usable value. Surfaced as 500.
 */
public class PredictionException extends RuntimeException {

    public PredictionException(String message) {
        super(message);
    }

    public PredictionException(String message, Throwable cause) {
        super(message, cause);
    }
}
