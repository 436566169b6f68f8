package com.admissions.prediction.service;

import com.admissions.prediction.config.JwtProperties;
import com.admissions.prediction.security.Claims;
import com.admissions.prediction.security.CredentialStore;
import com.admissions.prediction.security.DecodedToken;
import com.admissions.prediction.security.TokenCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * AuthGate - Login and per-request authorization for the prediction service.
 *
 * Key Responsibilities:
 * - Issue an access token when a username/password pair matches the credential table
 * - Decide whether an Authorization header grants access to a protected call
 *
 * Authorization is a single pass through these states; each one is terminal:
 * <pre>
 * no header          -> MISSING_TOKEN
 * header present     -> MALFORMED_HEADER | decode
 * decode             -> INVALID_TOKEN | TOKEN_EXPIRED | subject check
 * subject check      -> UNKNOWN_SUBJECT | authorized(subject)
 * </pre>
 *
 * Both operations return an {@link AuthResult} rather than throwing. The web
 * layer maps every {@link AuthError} to 401 and stops the request before the
 * predictor runs.
 *
 * All collaborators hold immutable state, so the gate can be called from any
 * number of request threads without locking.
 *
 * @see TokenCodec for the token format
 * @see CredentialStore for the account table
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthGate {

    /** Literal scheme prefix expected in the Authorization header. */
    public static final String BEARER_PREFIX = "Bearer ";

    private final CredentialStore credentialStore;

    private final TokenCodec tokenCodec;

    private final JwtProperties jwtProperties;

    /**
     * Authenticate a username/password pair and issue an access token.
     *
     * @param username Account name from the login request
     * @param password Password from the login request (never logged)
     * @return the signed token, or INVALID_CREDENTIALS
     */
    public AuthResult<String> login(String username, String password) {
        if (!credentialStore.verify(username, password)) {
            log.info("Login rejected for username: {}", username);
            return AuthResult.failure(AuthError.INVALID_CREDENTIALS);
        }
        String token = tokenCodec.encode(username, jwtProperties.getAccessTokenTtl());
        log.info("User authenticated successfully: {}", username);
        return AuthResult.success(token);
    }

    /**
     * Resolve the subject of a request from its Authorization header.
     *
     * @param authorizationHeader Raw header value, null when the header is absent
     * @return the authenticated username, or the first check that failed
     */
    public AuthResult<String> authorize(String authorizationHeader) {
        if (authorizationHeader == null) {
            return reject(AuthError.MISSING_TOKEN);
        }
        if (!authorizationHeader.startsWith(BEARER_PREFIX)) {
            return reject(AuthError.MALFORMED_HEADER);
        }

        DecodedToken decoded = tokenCodec.decode(authorizationHeader.substring(BEARER_PREFIX.length()));
        switch (decoded.getStatus()) {
            case EXPIRED:
                return reject(AuthError.TOKEN_EXPIRED);
            case MALFORMED:
            case SIGNATURE_INVALID:
                return reject(AuthError.INVALID_TOKEN);
            default:
                break;
        }

        Claims claims = decoded.getClaims();
        // Accounts removed after issuance must not keep access through old tokens
        if (!credentialStore.contains(claims.getSubject())) {
            return reject(AuthError.UNKNOWN_SUBJECT);
        }
        return AuthResult.success(claims.getSubject());
    }

    private AuthResult<String> reject(AuthError error) {
        log.info("Request authorization failed: {}", error);
        return AuthResult.failure(error);
    }
}
