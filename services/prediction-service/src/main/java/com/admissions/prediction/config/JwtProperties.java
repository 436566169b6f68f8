package com.admissions.prediction.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Token signing settings, bound to the {@code jwt} prefix.
 *
 * <p>The secret must be at least 256 bits for HS256 (longer for HS384/HS512);
 * a shorter key is rejected when {@link com.admissions.prediction.security.TokenCodec}
 * is created, which aborts startup.</p>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "jwt")
public class JwtProperties {

    /** HMAC signing secret. Override with JWT_SECRET outside local runs. */
    @NotBlank
    private String secret;

    /** JWS algorithm name, HMAC family only. */
    @NotBlank
    private String algorithm = "HS256";

    /** Lifetime of issued access tokens. */
    @NotNull
    private Duration accessTokenTtl = Duration.ofMinutes(30);

    /**
     * Token expiry is a whole-second claim, so a zero, negative or fractional
     * lifetime would issue tokens that are already expired or never usable.
     *
     * @return true if the ttl is unset (reported by {@code @NotNull}) or a positive whole number of seconds
     */
    @AssertTrue(message = "jwt.access-token-ttl must be a positive whole number of seconds")
    public boolean isAccessTokenTtlValid() {
        if (accessTokenTtl == null) {
            return true;
        }
        return !accessTokenTtl.isNegative() && !accessTokenTtl.isZero() && accessTokenTtl.getNano() == 0;
    }
}
