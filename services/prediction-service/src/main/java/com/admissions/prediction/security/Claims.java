package com.admissions.prediction.security;

import lombok.Value;

import java.time.Instant;

/**
 * Decoded payload of an authentic token.
 */
@Value
public class Claims {
    /** Username the token was issued to ("sub"). */
    String subject;

    /** Instant from which the token is no longer accepted ("exp"). */
    Instant expiresAt;
}
