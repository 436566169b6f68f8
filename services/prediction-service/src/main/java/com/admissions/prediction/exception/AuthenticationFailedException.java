package com.admissions.prediction.exception;

import com.admissions.prediction.service.AuthError;
import lombok.Getter;

/**
 * Raised at the HTTP boundary when {@link com.admissions.prediction.service.AuthGate}
 * rejects a request. The error kind is kept for logging only; clients see one
 * generic message per endpoint.
 */
@Getter
public class AuthenticationFailedException extends RuntimeException {

    private final AuthError error;

    public AuthenticationFailedException(AuthError error, String message) {
        super(message);
        this.error = error;
    }
}
