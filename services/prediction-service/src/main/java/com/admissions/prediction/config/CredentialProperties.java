package com.admissions.prediction.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed account table, bound to the {@code auth} prefix.
 *
 * <pre>
 * auth:
 *   users:
 *     - username: admin
 *       password: admin123
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "auth")
public class CredentialProperties {

    @Valid
    @NotEmpty
    private List<Account> users = new ArrayList<>();

    @Data
    public static class Account {
        @NotBlank
        private String username;

        @NotBlank
        private String password;
    }
}
