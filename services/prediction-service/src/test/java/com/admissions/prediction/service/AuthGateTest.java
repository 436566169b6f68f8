package com.admissions.prediction.service;

import com.admissions.prediction.config.JwtProperties;
import com.admissions.prediction.security.Credential;
import com.admissions.prediction.security.CredentialStore;
import com.admissions.prediction.security.TokenCodec;
import com.admissions.prediction.support.MutableClock;
import com.admissions.prediction.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for AuthGate.
 *
 * Tests cover:
 * - Login success and failure (token issued only for valid credentials)
 * - Every authorization failure kind
 * - Token lifetime boundary
 * - Accounts removed after issuance
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AuthGate Unit Tests")
class AuthGateTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    private CredentialStore credentialStore;

    @Mock
    private TokenCodec tokenCodec;

    @Mock
    private JwtProperties jwtProperties;

    @InjectMocks
    private AuthGate authGate;

    @Nested
    @DisplayName("Login with collaborators mocked")
    class LoginWithMocks {

        @Test
        @DisplayName("Should issue a token with the configured lifetime for valid credentials")
        void shouldIssueTokenForValidCredentials() {
            // Given
            when(credentialStore.verify("admin", "admin123")).thenReturn(true);
            when(jwtProperties.getAccessTokenTtl()).thenReturn(Duration.ofMinutes(30));
            when(tokenCodec.encode("admin", Duration.ofMinutes(30))).thenReturn("signed.token.value");

            // When
            AuthResult<String> result = authGate.login("admin", "admin123");

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getValue()).isEqualTo("signed.token.value");
        }

        @Test
        @DisplayName("Should fail with INVALID_CREDENTIALS and issue no token")
        void shouldNotIssueTokenForInvalidCredentials() {
            // Given
            when(credentialStore.verify("admin", "wrongpassword")).thenReturn(false);

            // When
            AuthResult<String> result = authGate.login("admin", "wrongpassword");

            // Then
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).isEqualTo(AuthError.INVALID_CREDENTIALS);
            verify(tokenCodec, never()).encode(anyString(), any(Duration.class));
        }
    }

    @Nested
    @DisplayName("Login and authorize with real collaborators")
    class EndToEnd {

        private MutableClock clock;
        private AuthGate gate;
        private TokenCodec codec;

        @BeforeEach
        void setUp() {
            clock = new MutableClock(NOW);
            codec = new TokenCodec(TestFixtures.jwtProperties(), clock);
            gate = new AuthGate(accounts(), codec, TestFixtures.jwtProperties());
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource({"admin,admin123", "user,pass123"})
        @DisplayName("Should authorize the token of every valid login as its own username")
        void shouldRoundTripEveryAccount(String username, String password) {
            AuthResult<String> login = gate.login(username, password);

            AuthResult<String> authorized = gate.authorize("Bearer " + login.getValue());

            assertThat(authorized.isSuccess()).isTrue();
            assertThat(authorized.getValue()).isEqualTo(username);
        }

        @ParameterizedTest(name = "{0}/{1}")
        @CsvSource({"admin,wrongpassword", "admin,pass123", "user,admin123", "ghost,admin123", "'',''"})
        @DisplayName("Should reject every invalid pair")
        void shouldRejectInvalidPairs(String username, String password) {
            AuthResult<String> login = gate.login(username, password);

            assertThat(login.getError()).isEqualTo(AuthError.INVALID_CREDENTIALS);
        }

        @Test
        @DisplayName("Should fail with MISSING_TOKEN when no header is sent")
        void shouldRejectMissingHeader() {
            assertThat(gate.authorize(null).getError()).isEqualTo(AuthError.MISSING_TOKEN);
        }

        @ParameterizedTest(name = "[{0}]")
        @ValueSource(strings = {"", "Bearer", "bearer abc", "Basic YWRtaW46YWRtaW4xMjM=", "Token abc", " Bearer abc"})
        @DisplayName("Should fail with MALFORMED_HEADER without the literal 'Bearer ' prefix")
        void shouldRejectOtherSchemes(String header) {
            assertThat(gate.authorize(header).getError()).isEqualTo(AuthError.MALFORMED_HEADER);
        }

        @ParameterizedTest(name = "[{0}]")
        @ValueSource(strings = {"Bearer ", "Bearer garbage", "Bearer a.b.c", "Bearer  "})
        @DisplayName("Should fail with INVALID_TOKEN for unparseable tokens")
        void shouldRejectGarbageTokens(String header) {
            assertThat(gate.authorize(header).getError()).isEqualTo(AuthError.INVALID_TOKEN);
        }

        @Test
        @DisplayName("Should fail with INVALID_TOKEN when the signature is altered")
        void shouldRejectTamperedToken() {
            String token = gate.login("admin", "admin123").getValue();
            int signatureStart = token.lastIndexOf('.') + 1;
            char replacement = token.charAt(signatureStart) == 'A' ? 'g' : 'A';
            String tampered = token.substring(0, signatureStart) + replacement + token.substring(signatureStart + 1);

            assertThat(gate.authorize("Bearer " + tampered).getError()).isEqualTo(AuthError.INVALID_TOKEN);
        }

        @Test
        @DisplayName("Should fail with INVALID_TOKEN for every other final signature character")
        void shouldRejectEveryLastCharacterSubstitution() {
            String token = gate.login("admin", "admin123").getValue();
            int last = token.length() - 1;

            for (char replacement : "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-_".toCharArray()) {
                if (replacement == token.charAt(last)) {
                    continue;
                }
                String tampered = token.substring(0, last) + replacement;

                assertThat(gate.authorize("Bearer " + tampered).getError())
                        .as("last character replaced with '%s'", replacement)
                        .isEqualTo(AuthError.INVALID_TOKEN);
            }
        }

        @Test
        @DisplayName("Should accept before the ttl elapses and fail with TOKEN_EXPIRED at and after it")
        void shouldExpireAtTtl() {
            String header = "Bearer " + gate.login("admin", "admin123").getValue();

            clock.set(NOW.plus(Duration.ofMinutes(30)).minusSeconds(1));
            assertThat(gate.authorize(header).isSuccess()).isTrue();

            clock.set(NOW.plus(Duration.ofMinutes(30)));
            assertThat(gate.authorize(header).getError()).isEqualTo(AuthError.TOKEN_EXPIRED);

            clock.advance(Duration.ofDays(1));
            assertThat(gate.authorize(header).getError()).isEqualTo(AuthError.TOKEN_EXPIRED);
        }

        @Test
        @DisplayName("Should fail with UNKNOWN_SUBJECT once the account is gone")
        void shouldRejectRemovedAccount() {
            String header = "Bearer " + gate.login("user", "pass123").getValue();
            AuthGate restarted = new AuthGate(
                    new CredentialStore(List.of(new Credential("admin", "admin123"))),
                    codec,
                    TestFixtures.jwtProperties());

            assertThat(restarted.authorize(header).getError()).isEqualTo(AuthError.UNKNOWN_SUBJECT);
        }

        private CredentialStore accounts() {
            return new CredentialStore(List.of(
                    new Credential("admin", "admin123"),
                    new Credential("user", "pass123")));
        }
    }
}
