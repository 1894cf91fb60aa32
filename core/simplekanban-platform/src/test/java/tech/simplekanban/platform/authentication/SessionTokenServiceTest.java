package tech.simplekanban.platform.authentication;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.simplekanban.platform.identity.AuthFailure;
import tech.simplekanban.platform.identity.CredentialRejectedException;
import tech.simplekanban.platform.identity.CredentialSource;
import tech.simplekanban.platform.identity.Principal;
import tech.simplekanban.platform.testing.AuthConfigFixture;
import tech.simplekanban.platform.testing.Fixtures;
import tech.simplekanban.platform.user.User;
import tech.simplekanban.platform.user.UserRepository;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SessionTokenService.
 * Tokens are really signed and verified; only the user lookup and revocation list are mocked.
 */
@ExtendWith(MockitoExtension.class)
class SessionTokenServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");
    private static final String USER_ID = "usr_0HZUSER00001";

    @Mock
    UserRepository userRepository;

    @Mock
    SessionRevocationService revocationService;

    private AuthConfigFixture config;
    private SessionTokenService service;

    @BeforeEach
    void setUp() {
        config = new AuthConfigFixture();
        config.sessionLifetime = Duration.ofHours(1);
        service = newService(Fixtures.secretKeyProvider());
    }

    // ========================================
    // issue / validate TESTS
    // ========================================

    @Test
    @DisplayName("validate should return the issuing user's principal when token is fresh")
    void validate_shouldReturnPrincipal_whenTokenIssuedForActiveUser() {
        // Arrange
        User user = Fixtures.user(USER_ID, true, false);
        when(userRepository.findByIdOptional(USER_ID)).thenReturn(Optional.of(user));
        SessionToken token = service.issue(user);

        // Act
        Principal principal = service.validate(token.token());

        // Assert
        assertThat(principal.userId()).isEqualTo(USER_ID);
        assertThat(principal.source()).isEqualTo(CredentialSource.SESSION);
        assertThat(principal.sessionId()).isEqualTo(token.sessionId());
        assertThat(principal.scopes()).isEmpty();
        assertThat(principal.admin()).isFalse();
    }

    @Test
    @DisplayName("issue should set expiry to issue time plus the configured lifetime")
    void issue_shouldSetExpiry_fromConfiguredLifetime() {
        SessionToken token = service.issue(Fixtures.user(USER_ID, true, false));

        assertThat(token.issuedAt()).isEqualTo(NOW);
        assertThat(token.expiresAt()).isEqualTo(NOW.plus(Duration.ofHours(1)));
        assertThat(token.token()).doesNotStartWith("sk_");
    }

    @Test
    @DisplayName("validate should reflect the current administrator flag of the user")
    void validate_shouldUseCurrentAdminFlag_whenUserPromotedAfterIssue() {
        // Arrange
        User user = Fixtures.user(USER_ID, true, false);
        SessionToken token = service.issue(user);
        when(userRepository.findByIdOptional(USER_ID)).thenReturn(Optional.of(Fixtures.user(USER_ID, true, true)));

        // Act & Assert
        assertThat(service.validate(token.token()).admin()).isTrue();
    }

    @Test
    @DisplayName("validate should reject with INACTIVE when the user has been deactivated")
    void validate_shouldRejectInactive_whenUserDeactivated() {
        // Arrange
        SessionToken token = service.issue(Fixtures.user(USER_ID, true, false));
        when(userRepository.findByIdOptional(USER_ID)).thenReturn(Optional.of(Fixtures.user(USER_ID, false, false)));

        // Act & Assert
        assertRejected(() -> service.validate(token.token()), AuthFailure.INACTIVE);
    }

    @Test
    @DisplayName("validate should reject with INACTIVE when the user no longer exists")
    void validate_shouldRejectInactive_whenUserMissing() {
        SessionToken token = service.issue(Fixtures.user(USER_ID, true, false));
        when(userRepository.findByIdOptional(USER_ID)).thenReturn(Optional.empty());

        assertRejected(() -> service.validate(token.token()), AuthFailure.INACTIVE);
    }

    @Test
    @DisplayName("validate should reject with REVOKED when the password changed after the token was issued")
    void validate_shouldRejectRevoked_whenCredentialsChangedAfterIssue() {
        // Arrange
        SessionToken token = service.issue(Fixtures.user(USER_ID, true, false));
        User user = Fixtures.user(USER_ID, true, false);
        user.credentialsChangedAt = NOW.plusSeconds(60);
        when(userRepository.findByIdOptional(USER_ID)).thenReturn(Optional.of(user));
        service.clock = Clock.fixed(NOW.plusSeconds(120), ZoneOffset.UTC);

        // Act & Assert
        assertRejected(() -> service.validate(token.token()), AuthFailure.REVOKED);
    }

    @Test
    @DisplayName("validate should accept a token issued in the same second as the password change")
    void validate_shouldAccept_whenIssuedAtCredentialChange() {
        // Arrange
        User user = Fixtures.user(USER_ID, true, false);
        user.credentialsChangedAt = NOW;
        when(userRepository.findByIdOptional(USER_ID)).thenReturn(Optional.of(user));
        SessionToken token = service.issue(user);

        // Act & Assert
        assertThat(service.validate(token.token()).userId()).isEqualTo(USER_ID);
    }

    // ========================================
    // expiry boundary TESTS
    // ========================================

    @Test
    @DisplayName("verify should reject a token at exactly its expiration instant")
    void verify_shouldReject_whenExactlyAtExpiry() {
        // Arrange
        SessionToken token = service.issue(Fixtures.user(USER_ID, true, false));
        service.clock = Clock.fixed(token.expiresAt(), ZoneOffset.UTC);

        // Act & Assert
        assertRejected(() -> service.verify(token.token()), AuthFailure.EXPIRED);
    }

    @Test
    @DisplayName("verify should accept a token one second before its expiration instant")
    void verify_shouldAccept_whenJustBeforeExpiry() {
        // Arrange
        SessionToken token = service.issue(Fixtures.user(USER_ID, true, false));
        service.clock = Clock.fixed(token.expiresAt().minusSeconds(1), ZoneOffset.UTC);

        // Act
        SessionClaims claims = service.verify(token.token());

        // Assert
        assertThat(claims.userId()).isEqualTo(USER_ID);
        assertThat(claims.sessionId()).isEqualTo(token.sessionId());
    }

    @Test
    @DisplayName("verify should reject a token whose issue time is in the future")
    void verify_shouldReject_whenIssuedInTheFuture() {
        SessionToken token = service.issue(Fixtures.user(USER_ID, true, false));
        service.clock = Clock.fixed(NOW.minusSeconds(30), ZoneOffset.UTC);

        assertRejected(() -> service.verify(token.token()), AuthFailure.EXPIRED);
    }

    // ========================================
    // signature TESTS
    // ========================================

    @Test
    @DisplayName("verify should reject a token signed with a different secret before any lookup")
    void verify_shouldRejectInvalidSignature_whenSignedWithOtherSecret() {
        // Arrange
        SessionTokenService otherServer = newService(SecretKeyProvider.of(
            "another-signing-secret-with-enough-entropy-123".getBytes(StandardCharsets.UTF_8),
            Fixtures.API_KEY_HASH_SECRET));
        SessionToken forged = otherServer.issue(Fixtures.user(USER_ID, true, true));

        // Act & Assert
        assertRejected(() -> service.validate(forged.token()), AuthFailure.INVALID_SIGNATURE);
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("verify should reject a token whose payload was altered")
    void verify_shouldRejectInvalidSignature_whenPayloadTampered() {
        // Arrange
        String token = service.issue(Fixtures.user(USER_ID, true, false)).token();
        String[] parts = token.split("\\.");
        String tamperedPayload = java.util.Base64.getUrlEncoder().withoutPadding().encodeToString(
            ("{\"iss\":\"simple-kanban\",\"sub\":\"usr_0HZADMIN0001\",\"jti\":\"x\",\"iat\":"
                + NOW.getEpochSecond() + ",\"exp\":" + NOW.plusSeconds(3600).getEpochSecond() + "}")
                .getBytes(StandardCharsets.UTF_8));
        String tampered = parts[0] + "." + tamperedPayload + "." + parts[2];

        // Act & Assert
        assertRejected(() -> service.verify(tampered), AuthFailure.INVALID_SIGNATURE);
    }

    @Test
    @DisplayName("verify should reject an unsigned token")
    void verify_shouldRejectInvalidSignature_whenAlgorithmIsNone() {
        String header = java.util.Base64.getUrlEncoder().withoutPadding()
            .encodeToString("{\"alg\":\"none\"}".getBytes(StandardCharsets.UTF_8));
        String payload = java.util.Base64.getUrlEncoder().withoutPadding()
            .encodeToString(("{\"sub\":\"" + USER_ID + "\"}").getBytes(StandardCharsets.UTF_8));

        assertRejected(() -> service.verify(header + "." + payload + "."), AuthFailure.INVALID_SIGNATURE);
    }

    @Test
    @DisplayName("verify should reject garbage input as MALFORMED")
    void verify_shouldRejectMalformed_whenNotACompactJws() {
        assertRejected(() -> service.verify("definitely-not-a-token"), AuthFailure.MALFORMED);
    }

    @Test
    @DisplayName("verify should reject a token from another issuer")
    void verify_shouldReject_whenIssuerDiffers() {
        // Arrange
        AuthConfigFixture otherIssuer = new AuthConfigFixture();
        otherIssuer.issuer = "someone-else";
        SessionTokenService other = newService(Fixtures.secretKeyProvider());
        other.authConfig = otherIssuer;
        String token = other.issue(Fixtures.user(USER_ID, true, false)).token();

        // Act & Assert
        assertRejected(() -> service.verify(token), AuthFailure.INVALID_SIGNATURE);
    }

    // ========================================
    // revocation TESTS
    // ========================================

    @Test
    @DisplayName("verify should reject a token whose session was revoked at logout")
    void verify_shouldRejectRevoked_whenSessionOnDenylist() {
        // Arrange
        SessionToken token = service.issue(Fixtures.user(USER_ID, true, false));
        when(revocationService.isRevoked(token.sessionId())).thenReturn(true);

        // Act & Assert
        assertRejected(() -> service.verify(token.token()), AuthFailure.REVOKED);
    }

    private SessionTokenService newService(SecretKeyProvider keys) {
        SessionTokenService tokenService = new SessionTokenService();
        tokenService.authConfig = config;
        tokenService.secretKeyProvider = keys;
        tokenService.revocationService = revocationService;
        tokenService.userRepository = userRepository;
        tokenService.clock = Clock.fixed(NOW, ZoneOffset.UTC);
        return tokenService;
    }

    private static void assertRejected(org.assertj.core.api.ThrowableAssert.ThrowingCallable call, AuthFailure failure) {
        assertThatThrownBy(call)
            .isInstanceOf(CredentialRejectedException.class)
            .satisfies(e -> assertThat(((CredentialRejectedException) e).failure()).isEqualTo(failure));
    }
}
