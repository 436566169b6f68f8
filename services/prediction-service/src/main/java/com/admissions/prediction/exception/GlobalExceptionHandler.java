package com.admissions.prediction.exception;

import com.admissions.prediction.dto.ErrorResponse;
import com.admissions.prediction.prediction.FeatureRecord;
import com.admissions.prediction.service.AuthError;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Maps exceptions to the service's JSON error body.
 *
 * Authentication failures carry only the generic message chosen at the
 * boundary; the specific {@link AuthError} is logged, never returned.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<ErrorResponse> handleAuthentication(AuthenticationFailedException ex, HttpServletRequest req) {
        log.info("Unauthorized {} {}: {}", req.getMethod(), req.getRequestURI(), ex.getError());
        HttpHeaders headers = new HttpHeaders();
        if (ex.getError() != AuthError.INVALID_CREDENTIALS) {
            headers.set(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .headers(headers)
                .body(body(HttpStatus.UNAUTHORIZED, ex.getMessage(), req, null));
    }

    @ExceptionHandler(FeatureValidationException.class)
    public ResponseEntity<ErrorResponse> handleFeatureValidation(FeatureValidationException ex, HttpServletRequest req) {
        List<ErrorResponse.FieldError> errors = ex.getViolations().stream()
                .map(v -> new ErrorResponse.FieldError(v.getField(), v.getMessage()))
                .toList();
        return ResponseEntity.unprocessableEntity()
                .body(body(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), req, errors));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        List<ErrorResponse.FieldError> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> new ErrorResponse.FieldError(FeatureRecord.wireName(e.getField()), e.getDefaultMessage()))
                .sorted(Comparator.comparing(ErrorResponse.FieldError::getField))
                .toList();
        String message = errors.isEmpty() ? "Validation failed" : errors.get(0).getMessage();
        return ResponseEntity.unprocessableEntity()
                .body(body(HttpStatus.UNPROCESSABLE_ENTITY, message, req, errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest req) {
        log.debug("Unreadable request body on {}: {}", req.getRequestURI(), ex.getMessage());
        return ResponseEntity.unprocessableEntity()
                .body(body(HttpStatus.UNPROCESSABLE_ENTITY, "Malformed request body", req, null));
    }

    @ExceptionHandler(PredictionException.class)
    public ResponseEntity<ErrorResponse> handlePrediction(PredictionException ex, HttpServletRequest req) {
        log.error("Prediction failed on {}: {}", req.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.internalServerError()
                .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "Prediction failed", req, null));
    }

    @ExceptionHandler({
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class,
            NoResourceFoundException.class,
            ErrorResponseException.class
    })
    public ResponseEntity<ErrorResponse> handleFramework(Exception ex, HttpServletRequest req) {
        HttpStatusCode status = ((org.springframework.web.ErrorResponse) ex).getStatusCode();
        return ResponseEntity.status(status)
                .body(body(status, ex.getMessage(), req, null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAny(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error on {}", req.getRequestURI(), ex);
        return ResponseEntity.internalServerError()
                .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", req, null));
    }

    private static ErrorResponse body(HttpStatusCode status, String message, HttpServletRequest req,
                                      List<ErrorResponse.FieldError> errors) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(resolved != null ? resolved.getReasonPhrase() : String.valueOf(status.value()))
                .message(message)
                .path(req.getRequestURI())
                .errors(errors)
                .build();
    }
}
