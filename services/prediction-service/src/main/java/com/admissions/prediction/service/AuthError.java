package com.admissions.prediction.service;

/**
 * Why {@link AuthGate} refused a login or a protected request.
 * Every variant is reported to clients as 401 Unauthorized.
 */
public enum AuthError {
    /** Login: unknown username or wrong password. */
    INVALID_CREDENTIALS,
    /** No Authorization header. */
    MISSING_TOKEN,
    /** Authorization header without the "Bearer " scheme prefix. */
    MALFORMED_HEADER,
    /** Unparseable token or bad signature. */
    INVALID_TOKEN,
    /** Authentic token past its expiry. */
    TOKEN_EXPIRED,
    /** Authentic token whose subject is no longer a known account. */
    UNKNOWN_SUBJECT
}
