package com.admissions.prediction.exception;

import lombok.Getter;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Feature record rejected before prediction. Surfaced as 422 with one entry
 * per offending field.
 */
@Getter
public class FeatureValidationException extends RuntimeException {

    private final List<FieldViolation> violations;

    public FeatureValidationException(List<FieldViolation> violations) {
        super(violations.stream()
                .map(FieldViolation::getMessage)
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    @Value
    public static class FieldViolation {
        String field;
        String message;
    }
}
