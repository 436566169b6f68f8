package com.admissions.prediction.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Body of every error answer.
 *
 * <pre>
 * {
 *   "timestamp": "2024-01-15T10:30:00Z",
 *   "status": 422,
 *   "error": "Unprocessable Entity",
 *   "message": "GRE_Score must be between 0 and 340",
 *   "path": "/predict",
 *   "errors": [{"field": "GRE_Score", "message": "GRE_Score must be between 0 and 340"}]
 * }
 * </pre>
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    Instant timestamp;
    int status;
    String error;
    String message;
    String path;
    List<FieldError> errors;

    @Value
    public static class FieldError {
        String field;
        String message;
    }
}
