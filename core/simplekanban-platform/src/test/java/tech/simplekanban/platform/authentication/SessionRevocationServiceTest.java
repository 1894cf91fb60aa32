package tech.simplekanban.platform.authentication;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.simplekanban.platform.cache.CacheStore;
import tech.simplekanban.platform.testing.AuthConfigFixture;
import tech.simplekanban.platform.testing.MapCacheStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionRevocationServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");

    @Mock
    CacheStore failingCache;

    private AuthConfigFixture config;
    private MapCacheStore cache;
    private SessionRevocationService service;

    @BeforeEach
    void setUp() {
        config = new AuthConfigFixture();
        cache = new MapCacheStore();
        service = new SessionRevocationService();
        service.authConfig = config;
        service.cacheStore = cache;
        service.clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Test
    @DisplayName("revoke should keep the session id until the token would have expired")
    void revoke_shouldStoreSessionId_withRemainingLifetimeAsTtl() {
        // Arrange
        SessionClaims claims = new SessionClaims("usr_1", "sess_1", NOW.minusSeconds(60), NOW.plusSeconds(600));

        // Act
        service.revoke(claims);

        // Assert
        assertThat(service.isRevoked("sess_1")).isTrue();
        assertThat(service.isRevoked("sess_2")).isFalse();
        assertThat(cache.ttls).containsValue(Duration.ofSeconds(600));
    }

    @Test
    @DisplayName("revoke should skip already expired sessions")
    void revoke_shouldDoNothing_whenTokenAlreadyExpired() {
        service.revoke(new SessionClaims("usr_1", "sess_1", NOW.minusSeconds(600), NOW));

        assertThat(cache.values).isEmpty();
    }

    @Test
    @DisplayName("isRevoked should return false when revocation is disabled")
    void isRevoked_shouldReturnFalse_whenDisabled() {
        // Arrange
        service.revoke(new SessionClaims("usr_1", "sess_1", NOW, NOW.plusSeconds(600)));
        config.revocationEnabled = false;

        // Act & Assert
        assertThat(service.isRevoked("sess_1")).isFalse();
    }

    @Test
    @DisplayName("isRevoked should fail open when the cache is unavailable")
    void isRevoked_shouldReturnFalse_whenCacheThrows() {
        // Arrange
        service.cacheStore = failingCache;
        when(failingCache.get(anyString(), anyString())).thenThrow(new IllegalStateException("redis down"));

        // Act & Assert
        assertThat(service.isRevoked("sess_1")).isFalse();
    }

    @Test
    @DisplayName("revoke should not propagate cache failures to logout")
    void revoke_shouldSwallowCacheFailure_andLog() {
        // Arrange
        service.cacheStore = failingCache;
        doThrow(new IllegalStateException("redis down"))
            .when(failingCache).put(anyString(), anyString(), anyString(), any(Duration.class));

        // Act & Assert
        assertThatCode(() -> service.revoke(new SessionClaims("usr_1", "sess_1", NOW, NOW.plusSeconds(60))))
            .doesNotThrowAnyException();
    }
}
