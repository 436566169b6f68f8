package com.admissions.prediction.controller;

import com.admissions.prediction.prediction.FeatureRecord;
import com.admissions.prediction.prediction.PredictionResult;
import com.admissions.prediction.service.PredictionService;
import com.admissions.prediction.web.BearerTokenInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * PredictionController - Protected prediction endpoint.
 *
 * Endpoints:
 * - POST /predict - Chance of admission for a feature record (requires Bearer token)
 *
 * By the time this method runs, {@link BearerTokenInterceptor} has already
 * authorized the request and stored the subject as a request attribute.
 * The prediction itself completes asynchronously, off the servlet thread.
 *
 * Error Handling:
 * - 401 Unauthorized: missing, malformed, invalid or expired token
 * - 422 Unprocessable Entity: a feature is missing or out of range
 * - 500 Internal Server Error: the predictor failed
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class PredictionController {

    private final PredictionService predictionService;

    /**
     * @param features Feature record from the request body, validated by the service
     * @param subject Username the bearer token was issued to
     * @return future result, completed on the prediction executor
     */
    @PostMapping(path = "/predict",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public CompletableFuture<PredictionResult> predict(
            @RequestBody FeatureRecord features,
            @RequestAttribute(BearerTokenInterceptor.SUBJECT_ATTRIBUTE) String subject) {
        log.debug("Prediction requested by {}", subject);
        return predictionService.predict(features);
    }
}
