package com.admissions.prediction.controller;

import com.admissions.prediction.dto.LoginRequest;
import com.admissions.prediction.dto.TokenResponse;
import com.admissions.prediction.exception.AuthenticationFailedException;
import com.admissions.prediction.service.AuthGate;
import com.admissions.prediction.service.AuthResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * AuthController - Token issuance endpoint.
 *
 * Endpoints:
 * - POST /login - Exchange username/password for a bearer token
 *
 * Error Handling:
 * - 401 Unauthorized: "Incorrect username or password"
 * - 422 Unprocessable Entity: username or password missing
 *
 * @see AuthGate#login for the credential check
 */
@RestController
@RequiredArgsConstructor
public class AuthController {

    public static final String LOGIN_FAILURE_MESSAGE = "Incorrect username or password";

    private final AuthGate authGate;

    /**
     * Exchange a username/password pair for a bearer token.
     *
     * Any mismatch answers with the same generic message, so the response
     * does not reveal whether the username exists.
     *
     * @param request Login request with username and password
     * @return 200 with the signed token, or 401 via {@link AuthenticationFailedException}
     */
    @PostMapping(path = "/login",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        AuthResult<String> result = authGate.login(request.getUsername(), request.getPassword());
        if (!result.isSuccess()) {
            throw new AuthenticationFailedException(result.getError(), LOGIN_FAILURE_MESSAGE);
        }
        return ResponseEntity.ok(TokenResponse.bearer(result.getValue()));
    }
}
