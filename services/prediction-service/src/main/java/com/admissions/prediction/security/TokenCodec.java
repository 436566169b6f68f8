package com.admissions.prediction.security;

import com.admissions.prediction.config.JwtProperties;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Header;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Encoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * TokenCodec - Encodes and decodes signed, time-bound access tokens.
 *
 * Tokens are compact JWS strings (RFC 7515) carrying:
 * - sub: the username the token was issued to
 * - iat: issue time
 * - exp: expiry time
 *
 * and signed with an HMAC algorithm (HS256 by default) over a process-wide
 * secret. Nothing is stored server-side: authenticity is a pure function of
 * the token, the secret and the current time, so the codec is safe to call
 * from any number of request threads.
 *
 * Configuration (from application.yml):
 * - jwt.secret: HMAC signing key (min 256 bits for HS256)
 * - jwt.algorithm: HS256, HS384 or HS512
 *
 * The signing key is derived once in the constructor. A missing, weak or
 * non-HMAC configuration throws there, which aborts application startup.
 *
 * Decoding never throws: every outcome is reported as a {@link DecodedToken}
 * status so callers can branch on it without exception handling.
 *
 * @see com.admissions.prediction.service.AuthGate for issuance and verification context
 */
@Slf4j
@Component
public class TokenCodec {

    private final Key signingKey;
    private final SignatureAlgorithm algorithm;
    private final Clock clock;
    private final JwtParser parser;

    public TokenCodec(JwtProperties properties, Clock clock) {
        this.algorithm = resolveAlgorithm(properties.getAlgorithm());
        this.signingKey = deriveKey(properties.getSecret(), algorithm);
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Create a signed token for a subject.
     *
     * The issue time is truncated to whole seconds because JWT numeric dates
     * carry second precision; this keeps {@code exp} exactly {@code iat + ttl}.
     *
     * @param subject Username to embed as the "sub" claim
     * @param ttl Lifetime of the token, must be positive
     * @return Compact serialized JWT (header.payload.signature)
     */
    public String encode(String subject, Duration ttl) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Token subject must not be blank");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Token ttl must be positive");
        }
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        return Jwts.builder()
                .setSubject(subject)
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(issuedAt.plus(ttl)))
                .signWith(signingKey, algorithm)
                .compact();
    }

    /**
     * Verify a token and extract its claims.
     *
     * Checks, in order:
     * 1. Structure: three base64url segments, signed, JSON payload
     * 2. Signature: recomputed with the configured key and algorithm, and
     *    spelled in canonical base64url
     * 3. Expiry: rejected once {@code exp <= now}
     * 4. Required claims: "sub" and "exp" present
     *
     * Signature is checked before expiry, so a tampered token that is also
     * expired reports {@link DecodedToken.Status#SIGNATURE_INVALID}.
     *
     * @param token Token string without the "Bearer " prefix
     * @return VALID with claims, or MALFORMED / SIGNATURE_INVALID / EXPIRED
     */
    public DecodedToken decode(String token) {
        if (token == null || token.isBlank()) {
            return DecodedToken.failed(DecodedToken.Status.MALFORMED);
        }
        try {
            Jws<io.jsonwebtoken.Claims> jws = parser.parseClaimsJws(token);
            if (!isExpectedAlgorithm(jws.getHeader()) || !hasCanonicalSignature(token)) {
                return DecodedToken.failed(DecodedToken.Status.SIGNATURE_INVALID);
            }
            return toClaims(jws.getBody());
        } catch (ExpiredJwtException e) {
            // jjwt verified the signature bytes before checking exp, but not their encoding
            if (!isExpectedAlgorithm(e.getHeader()) || !hasCanonicalSignature(token)) {
                return DecodedToken.failed(DecodedToken.Status.SIGNATURE_INVALID);
            }
            return DecodedToken.failed(DecodedToken.Status.EXPIRED);
        } catch (SecurityException e) {
            log.debug("Token signature rejected: {}", e.getMessage());
            return DecodedToken.failed(DecodedToken.Status.SIGNATURE_INVALID);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token could not be parsed: {}", e.getMessage());
            return DecodedToken.failed(DecodedToken.Status.MALFORMED);
        }
    }

    private boolean isExpectedAlgorithm(Header<?> header) {
        return header instanceof JwsHeader
                && algorithm.getValue().equals(((JwsHeader<?>) header).getAlgorithm());
    }

    /**
     * The decoder ignores the unused low bits of the final base64url character,
     * so several spellings of the segment carry the same signature bytes. Only
     * the spelling this codec itself produces is accepted.
     *
     * @param token Token that already passed signature verification
     * @return true if re-encoding the decoded signature yields the same text
     */
    private static boolean hasCanonicalSignature(String token) {
        String signature = token.substring(token.lastIndexOf('.') + 1);
        try {
            return Encoders.BASE64URL.encode(Decoders.BASE64URL.decode(signature)).equals(signature);
        } catch (DecodingException e) {
            log.debug("Token signature segment could not be decoded: {}", e.getMessage());
            return false;
        }
    }

    private DecodedToken toClaims(io.jsonwebtoken.Claims body) {
        String subject = body.getSubject();
        Date expiration = body.getExpiration();
        if (subject == null || subject.isBlank() || expiration == null) {
            return DecodedToken.failed(DecodedToken.Status.MALFORMED);
        }
        Instant expiresAt = expiration.toInstant();
        // jjwt accepts a token at exactly exp; the expiry instant itself is already invalid here
        if (!expiresAt.isAfter(clock.instant())) {
            return DecodedToken.failed(DecodedToken.Status.EXPIRED);
        }
        return DecodedToken.valid(new Claims(subject, expiresAt));
    }

    private static SignatureAlgorithm resolveAlgorithm(String name) {
        SignatureAlgorithm resolved;
        try {
            resolved = SignatureAlgorithm.forName(name);
        } catch (JwtException e) {
            throw new IllegalStateException("Unsupported jwt.algorithm: " + name, e);
        }
        if (!resolved.isHmac()) {
            throw new IllegalStateException("jwt.algorithm must be an HMAC algorithm (HS256, HS384, HS512), got " + name);
        }
        return resolved;
    }

    private static Key deriveKey(String secret, SignatureAlgorithm algorithm) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("jwt.secret must be configured");
        }
        try {
            Key key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
            algorithm.assertValidSigningKey(key);
            return key;
        } catch (JwtException e) {
            throw new IllegalStateException("jwt.secret is not usable with " + algorithm.getValue() + ": " + e.getMessage(), e);
        }
    }
}
