package com.admissions.prediction.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AuthResult Unit Tests")
class AuthResultTest {

    @Test
    @DisplayName("Should expose the value of a success and refuse its error")
    void shouldExposeSuccessValue() {
        AuthResult<String> result = AuthResult.success("admin");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue()).isEqualTo("admin");
        assertThatThrownBy(result::getError).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    @DisplayName("Should expose the error of a failure and refuse its value")
    void shouldExposeFailureError() {
        AuthResult<String> result = AuthResult.failure(AuthError.MISSING_TOKEN);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo(AuthError.MISSING_TOKEN);
        assertThatThrownBy(result::getValue).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    @DisplayName("Should print either variant without throwing")
    void shouldPrintBothVariants() {
        assertThat(AuthResult.success("admin").toString()).contains("admin");
        assertThat(AuthResult.failure(AuthError.TOKEN_EXPIRED).toString()).contains("TOKEN_EXPIRED");
    }

    @Test
    @DisplayName("Should compare and hash by value for both variants")
    void shouldCompareByValue() {
        assertThat(AuthResult.success("admin"))
                .isEqualTo(AuthResult.success("admin"))
                .hasSameHashCodeAs(AuthResult.success("admin"))
                .isNotEqualTo(AuthResult.success("user"));
        assertThat(AuthResult.failure(AuthError.MISSING_TOKEN))
                .isEqualTo(AuthResult.failure(AuthError.MISSING_TOKEN))
                .hasSameHashCodeAs(AuthResult.failure(AuthError.MISSING_TOKEN))
                .isNotEqualTo(AuthResult.failure(AuthError.INVALID_TOKEN));
        assertThat(AuthResult.<String>success("admin"))
                .isNotEqualTo(AuthResult.<String>failure(AuthError.UNKNOWN_SUBJECT));
    }
}
