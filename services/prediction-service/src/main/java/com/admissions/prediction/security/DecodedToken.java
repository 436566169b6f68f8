package com.admissions.prediction.security;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * Outcome of {@link TokenCodec#decode(String)}: either {@link Status#VALID}
 * with claims, or one of the failure statuses without them.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class DecodedToken {

    public enum Status {
        VALID,
        MALFORMED,
        SIGNATURE_INVALID,
        EXPIRED
    }

    private final Status status;
    private final Claims claims;

    public static DecodedToken valid(Claims claims) {
        return new DecodedToken(Status.VALID, claims);
    }

    public static DecodedToken failed(Status status) {
        if (status == Status.VALID) {
            throw new IllegalArgumentException("A valid token needs claims");
        }
        return new DecodedToken(status, null);
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    /**
     * @return the claims of a valid token, empty for every failure status
     */
    public Optional<Claims> claims() {
        return Optional.ofNullable(claims);
    }
}
