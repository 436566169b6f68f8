package com.admissions.prediction.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * LoginRequest - Payload of POST /login.
 *
 * <pre>
 * {
 *   "username": "admin",
 *   "password": "admin123"
 * }
 * </pre>
 *
 * Never log or persist the password field.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank(message = "username is required")
    private String username;

    @NotBlank(message = "password is required")
    @ToString.Exclude
    private String password;
}
