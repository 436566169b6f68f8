package com.admissions.prediction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * TokenResponse - Successful login result, OAuth 2.0 bearer token style.
 *
 * <pre>
 * {
 *   "access_token": "eyJhbGciOiJIUzI1NiJ9...",
 *   "token_type": "bearer"
 * }
 * </pre>
 */
@Value
public class TokenResponse {

    public static final String TOKEN_TYPE = "bearer";

    @JsonProperty("access_token")
    String accessToken;

    @JsonProperty("token_type")
    String tokenType;

    public static TokenResponse bearer(String accessToken) {
        return new TokenResponse(accessToken, TOKEN_TYPE);
    }
}
