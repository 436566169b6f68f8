package com.admissions.prediction.prediction;

import com.admissions.prediction.exception.PredictionException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * RemoteModelPredictionAdapter - Delegates prediction to an out-of-process model runner.
 *
 * Request:  POST {model.remote.base-url}/predict with the feature record as JSON
 * Response: {"prediction": 0.87}
 *
 * Transport errors, non-2xx answers and a missing prediction all raise
 * {@link PredictionException}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "model", name = "mode", havingValue = "remote")
public class RemoteModelPredictionAdapter implements PredictionAdapter {

    static final String PREDICT_PATH = "/predict";

    private final RestTemplate restTemplate;

    public RemoteModelPredictionAdapter(RestTemplate modelRestTemplate) {
        this.restTemplate = modelRestTemplate;
    }

    @Override
    public double run(FeatureRecord record) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            HttpEntity<FeatureRecord> request = new HttpEntity<>(record, headers);
            ResponseEntity<RemotePrediction> response =
                    restTemplate.postForEntity(PREDICT_PATH, request, RemotePrediction.class);
            RemotePrediction body = response.getBody();
            if (body == null || body.getPrediction() == null) {
                throw new PredictionException("Model runner returned no prediction");
            }
            return body.getPrediction();
        } catch (RestClientException ex) {
            log.warn("Model runner call failed: {}", ex.getMessage());
            throw new PredictionException("Model runner call failed: " + ex.getMessage(), ex);
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RemotePrediction {
        private Double prediction;
    }
}
