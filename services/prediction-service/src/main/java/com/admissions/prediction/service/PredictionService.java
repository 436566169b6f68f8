package com.admissions.prediction.service;

import com.admissions.prediction.exception.FeatureValidationException;
import com.admissions.prediction.exception.FeatureValidationException.FieldViolation;
import com.admissions.prediction.exception.PredictionException;
import com.admissions.prediction.prediction.FeatureRecord;
import com.admissions.prediction.prediction.PredictionAdapter;
import com.admissions.prediction.prediction.PredictionResult;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * PredictionService - Runs the predictor for an already authorized request.
 *
 * Flow:
 * 1. Validate the feature record against its declared bounds
 *    (rejected records never reach the predictor)
 * 2. Run the {@link PredictionAdapter} on the prediction executor
 * 3. Reject non-finite output, clamp the rest into [0, 1]
 *
 * The returned future completes with a full result or fails with
 * {@link PredictionException}; there is no partial or default value.
 */
@Slf4j
@Service
public class PredictionService {

    private final PredictionAdapter predictionAdapter;

    private final Validator validator;

    private final Executor predictionExecutor;

    public PredictionService(PredictionAdapter predictionAdapter,
                             Validator validator,
                             @Qualifier("predictionExecutor") Executor predictionExecutor) {
        this.predictionAdapter = predictionAdapter;
        this.validator = validator;
        this.predictionExecutor = predictionExecutor;
    }

    /**
     * @param record Feature record from the request body
     * @return future prediction result
     * @throws FeatureValidationException if any field is missing or out of range
     */
    public CompletableFuture<PredictionResult> predict(FeatureRecord record) {
        validate(record);
        try {
            return CompletableFuture.supplyAsync(() -> run(record), predictionExecutor);
        } catch (RejectedExecutionException ex) {
            log.warn("Prediction executor saturated: {}", ex.getMessage());
            return CompletableFuture.failedFuture(new PredictionException("Prediction capacity exhausted", ex));
        }
    }

    void validate(FeatureRecord record) {
        if (record == null) {
            throw new FeatureValidationException(List.of(new FieldViolation("body", "Feature record is required")));
        }
        Set<ConstraintViolation<FeatureRecord>> violations = validator.validate(record);
        if (!violations.isEmpty()) {
            List<FieldViolation> fields = violations.stream()
                    .map(v -> new FieldViolation(
                            FeatureRecord.wireName(v.getPropertyPath().toString()),
                            v.getMessage()))
                    .sorted(Comparator.comparing(FieldViolation::getField)
                            .thenComparing(FieldViolation::getMessage))
                    .toList();
            log.debug("Feature record rejected: {}", fields);
            throw new FeatureValidationException(fields);
        }
    }

    private PredictionResult run(FeatureRecord record) {
        long started = System.nanoTime();
        double raw;
        try {
            raw = predictionAdapter.run(record);
        } catch (PredictionException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.error("Predictor failed", ex);
            throw new PredictionException("Predictor failed: " + ex.getMessage(), ex);
        }
        if (!Double.isFinite(raw)) {
            throw new PredictionException("Predictor returned a non-finite value: " + raw);
        }
        double clamped = Math.max(0.0, Math.min(1.0, raw));
        log.debug("Prediction {} (raw {}) in {} us", clamped, raw, (System.nanoTime() - started) / 1_000);
        return new PredictionResult(clamped);
    }
}
