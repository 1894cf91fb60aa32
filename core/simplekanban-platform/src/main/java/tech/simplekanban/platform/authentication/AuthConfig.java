package tech.simplekanban.platform.authentication;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Configuration for authentication: session tokens, API key hashing, CSRF protection
 * and login throttling.
 *
 * Example configuration:
 * <pre>
 * simplekanban.auth.session.signing-secret=base64:q1b...   # at least 32 bytes
 * simplekanban.auth.api-key.hash-secret=base64:Zx9...     # at least 32 bytes
 * simplekanban.auth.session.lifetime=P7D
 * simplekanban.auth.csrf.exempt-paths=/api/auth/login,/api/auth/register
 * </pre>
 */
@ConfigMapping(prefix = "simplekanban.auth")
public interface AuthConfig {

    /**
     * Development only: generate (and persist locally) any secret that is missing or too weak
     * instead of refusing to start. Must stay false in production.
     */
    @WithName("allow-generated-secrets")
    @WithDefault("false")
    boolean allowGeneratedSecrets();

    /**
     * Directory where generated development secrets are persisted across restarts.
     */
    @WithName("dev-secret-dir")
    @WithDefault(".dev-secrets")
    String devSecretDir();

    SessionConfig session();

    @WithName("api-key")
    ApiKeyConfig apiKey();

    CsrfConfig csrf();

    @WithName("login-throttle")
    LoginThrottleConfig loginThrottle();

    /**
     * Session token and cookie configuration.
     */
    interface SessionConfig {
        /**
         * HMAC-SHA256 signing secret. Plain text, or "base64:" followed by base64 bytes.
         */
        @WithName("signing-secret")
        Optional<String> signingSecret();

        /**
         * Token lifetime. Short expiry plus the logout denylist stand in for server-side sessions.
         */
        @WithDefault("P7D")
        Duration lifetime();

        @WithDefault("simple-kanban")
        String issuer();

        @WithName("cookie-name")
        @WithDefault("kanban_session")
        String cookieName();

        /**
         * Whether session cookies should be secure (HTTPS only).
         */
        @WithName("secure-cookie")
        @WithDefault("true")
        boolean secureCookie();

        /**
         * SameSite attribute for session cookies: Strict, Lax or None.
         */
        @WithName("same-site")
        @WithDefault("Strict")
        String sameSite();

        /**
         * Record logged-out session ids in the cache until they expire.
         */
        @WithName("revocation-enabled")
        @WithDefault("true")
        boolean revocationEnabled();
    }

    /**
     * API key configuration.
     */
    interface ApiKeyConfig {
        /**
         * Keyed hash secret for stored API key hashes. Same format and strength rules as
         * the session signing secret. Rotating it invalidates every issued key.
         */
        @WithName("hash-secret")
        Optional<String> hashSecret();

        /**
         * Maximum lifetime that can be requested for a new key, in days.
         */
        @WithName("max-expiry-days")
        @WithDefault("365")
        int maxExpiryDays();
    }

    /**
     * Double-submit CSRF protection for browser sessions.
     */
    interface CsrfConfig {
        @WithDefault("true")
        boolean enabled();

        @WithName("header-name")
        @WithDefault("X-CSRF-Token")
        String headerName();

        @WithName("cookie-name")
        @WithDefault("kanban_csrf")
        String cookieName();

        /**
         * Paths (exact, or prefix when ending in '/*') never subject to the CSRF check.
         */
        @WithName("exempt-paths")
        @WithDefault("/api/auth/login,/api/auth/register,/api/auth/oidc/callback")
        List<String> exemptPaths();
    }

    /**
     * Throttling of failed password logins per account and address.
     */
    interface LoginThrottleConfig {
        @WithDefault("true")
        boolean enabled();

        @WithName("max-failed-attempts")
        @WithDefault("5")
        int maxFailedAttempts();

        @WithName("window-duration")
        @WithDefault("PT15M")
        Duration windowDuration();

        @WithName("lockout-duration")
        @WithDefault("PT15M")
        Duration lockoutDuration();
    }
}
