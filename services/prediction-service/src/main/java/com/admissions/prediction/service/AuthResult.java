package com.admissions.prediction.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Success value or {@link AuthError}, returned by {@link AuthGate} instead of
 * throwing so the gate stays independent of the transport layer.
 *
 * @param <T> type of the success value
 */
@ToString(doNotUseGetters = true)
@EqualsAndHashCode(doNotUseGetters = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AuthResult<T> {

    private final T value;
    private final AuthError error;

    /**
     * @param value Non-null success value
     * @return a successful result carrying the value
     */
    public static <T> AuthResult<T> success(T value) {
        return new AuthResult<>(Objects.requireNonNull(value, "value"), null);
    }

    /**
     * @param error Non-null failure kind
     * @return a failed result carrying the error
     */
    public static <T> AuthResult<T> failure(AuthError error) {
        return new AuthResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return the success value
     * @throws NoSuchElementException if this result is a failure
     */
    public T getValue() {
        if (!isSuccess()) {
            throw new NoSuchElementException("No value present, failed with " + error);
        }
        return value;
    }

    /**
     * @return the failure kind
     * @throws NoSuchElementException if this result is a success
     */
    public AuthError getError() {
        if (isSuccess()) {
            throw new NoSuchElementException("No error present");
        }
        return error;
    }
}
