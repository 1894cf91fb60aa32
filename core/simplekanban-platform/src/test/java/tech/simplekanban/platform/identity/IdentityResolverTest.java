package tech.simplekanban.platform.identity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.simplekanban.platform.apikey.ApiKey;
import tech.simplekanban.platform.apikey.ApiKeyService;
import tech.simplekanban.platform.apikey.ApiKeyUsageRecorder;
import tech.simplekanban.platform.authentication.SessionTokenService;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

    private static final String API_KEY = "sk_" + "A".repeat(43);

    @Mock
    SessionTokenService sessionTokenService;

    @Mock
    ApiKeyService apiKeyService;

    @Mock
    ApiKeyUsageRecorder usageRecorder;

    @InjectMocks
    IdentityResolver resolver;

    @Test
    @DisplayName("resolve should fail with MISSING_CREDENTIAL for blank input")
    void resolve_shouldFailMissing_whenBlank() {
        assertThat(resolver.resolve(null)).isEqualTo(Resolution.failed(AuthFailure.MISSING_CREDENTIAL));
        assertThat(resolver.resolve("  ")).isEqualTo(Resolution.failed(AuthFailure.MISSING_CREDENTIAL));
        verifyNoInteractions(sessionTokenService, apiKeyService);
    }

    @Test
    @DisplayName("resolve should route sk_ credentials to API key validation and record usage")
    void resolve_shouldValidateApiKey_whenPrefixed() {
        // Arrange
        ApiKey key = new ApiKey();
        key.id = "key_1";
        Principal principal = Principal.apiKey("usr_1", false, List.of("read"), "key_1");
        when(apiKeyService.validate(API_KEY)).thenReturn(new ApiKeyService.ValidatedApiKey(key, principal));

        // Act
        Resolution resolution = resolver.resolve(API_KEY);

        // Assert
        assertThat(resolution).isEqualTo(Resolution.resolved(principal));
        verify(usageRecorder).recordUse("key_1");
        verifyNoInteractions(sessionTokenService);
    }

    @Test
    @DisplayName("resolve should route other credentials to session validation")
    void resolve_shouldValidateSession_whenNotPrefixed() {
        // Arrange
        Principal principal = Principal.session("usr_1", false, "sess_1");
        when(sessionTokenService.validate("eyJ.token.sig")).thenReturn(principal);

        // Act
        Resolution resolution = resolver.resolve("eyJ.token.sig");

        // Assert
        assertThat(resolution).isEqualTo(Resolution.resolved(principal));
        verifyNoInteractions(apiKeyService, usageRecorder);
    }

    @Test
    @DisplayName("resolve should report an inactive key owner as INACTIVE")
    void resolve_shouldMapOwnerInactive_toInactive() {
        when(apiKeyService.validate(API_KEY)).thenThrow(new CredentialRejectedException(AuthFailure.OWNER_INACTIVE));

        assertThat(resolver.resolve(API_KEY)).isEqualTo(Resolution.failed(AuthFailure.INACTIVE));
        verify(usageRecorder, never()).recordUse(anyString());
    }

    @Test
    @DisplayName("resolve should pass through the failure reason of a rejected session")
    void resolve_shouldReturnFailure_whenSessionRejected() {
        when(sessionTokenService.validate("bad")).thenThrow(new CredentialRejectedException(AuthFailure.EXPIRED));

        assertThat(resolver.resolve("bad")).isEqualTo(Resolution.failed(AuthFailure.EXPIRED));
    }

    @Test
    @DisplayName("resolve should never treat an API key as a session token")
    void resolve_shouldNotFallBackToSession_whenApiKeyRejected() {
        when(apiKeyService.validate(API_KEY)).thenThrow(new CredentialRejectedException(AuthFailure.KEY_NOT_FOUND));

        assertThat(resolver.resolve(API_KEY)).isEqualTo(Resolution.failed(AuthFailure.KEY_NOT_FOUND));
        verifyNoInteractions(sessionTokenService);
    }
}
