package tech.simplekanban.platform.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.simplekanban.platform.cache.CacheStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Throttles failed password logins.
 *
 * <p>Failures are counted per login identifier in the cache. Once the count reaches
 * {@code max-failed-attempts} within {@code window-duration}, further attempts for that
 * identifier are blocked for {@code lockout-duration}. A successful login clears the counter.
 *
 * <p>When the cache is unreachable the limiter fails open: attempts are permitted and nothing
 * is recorded until it comes back.
 */
@ApplicationScoped
public class LoginAttemptLimiter {

    private static final Logger LOG = Logger.getLogger(LoginAttemptLimiter.class);
    private static final String CACHE_NAME = "login-attempts";

    @Inject
    AuthConfig authConfig;

    @Inject
    CacheStore cacheStore;

    @Inject
    Clock clock;

    public ThrottleResult check(String login) {
        if (!authConfig.loginThrottle().enabled()) {
            return ThrottleResult.allow();
        }
        try {
            return evaluate(login);
        } catch (RuntimeException e) {
            LOG.warnf("Login throttle lookup failed, permitting attempt for %s: %s", login, e.getMessage());
            return ThrottleResult.allow();
        }
    }

    private ThrottleResult evaluate(String login) {
        String cacheKey = cacheKey(login);
        Optional<String> cached = cacheStore.get(CACHE_NAME, cacheKey);
        if (cached.isEmpty()) {
            return ThrottleResult.allow();
        }

        AttemptEntry entry;
        try {
            entry = AttemptEntry.parse(cached.get());
        } catch (RuntimeException e) {
            LOG.warnf("Discarding unreadable login attempt entry for %s", login);
            cacheStore.invalidate(CACHE_NAME, cacheKey);
            return ThrottleResult.allow();
        }

        Instant now = clock.instant();
        if (entry.lockedUntil != null && now.isBefore(entry.lockedUntil)) {
            return ThrottleResult.block(Duration.between(now, entry.lockedUntil));
        }

        int maxAttempts = authConfig.loginThrottle().maxFailedAttempts();
        if (entry.failureCount >= maxAttempts) {
            Duration lockout = authConfig.loginThrottle().lockoutDuration();
            entry.lockedUntil = now.plus(lockout);
            try {
                cacheStore.put(CACHE_NAME, cacheKey, entry.serialize(), lockout);
            } catch (RuntimeException e) {
                LOG.warnf("Failed to store lockout for %s: %s", login, e.getMessage());
            }
            LOG.warnf("Too many failed logins for %s, locking for %s", login, lockout);
            return ThrottleResult.block(lockout);
        }

        return ThrottleResult.allow();
    }

    public void recordFailure(String login) {
        if (!authConfig.loginThrottle().enabled()) {
            return;
        }
        try {
            incrementFailures(login);
        } catch (RuntimeException e) {
            LOG.warnf("Failed to record failed login for %s: %s", login, e.getMessage());
        }
    }

    private void incrementFailures(String login) {
        String cacheKey = cacheKey(login);
        AttemptEntry entry = cacheStore.get(CACHE_NAME, cacheKey)
            .map(LoginAttemptLimiter::parseOrNull)
            .orElse(null);
        if (entry == null) {
            entry = new AttemptEntry(0, null);
        }
        entry.failureCount++;

        cacheStore.put(CACHE_NAME, cacheKey, entry.serialize(), authConfig.loginThrottle().windowDuration());
        LOG.debugf("Recorded failed login for %s, count=%d", login, entry.failureCount);
    }

    public void recordSuccess(String login) {
        if (!authConfig.loginThrottle().enabled()) {
            return;
        }
        try {
            cacheStore.invalidate(CACHE_NAME, cacheKey(login));
        } catch (RuntimeException e) {
            LOG.warnf("Failed to clear login failures for %s: %s", login, e.getMessage());
        }
    }

    private static String cacheKey(String login) {
        return login == null ? "" : login.trim().toLowerCase(Locale.ROOT);
    }

    private static AttemptEntry parseOrNull(String data) {
        try {
            return AttemptEntry.parse(data);
        } catch (RuntimeException e) {
            return null;
        }
    }

    /**
     * Outcome of a throttle check. {@code retryAfter} is null when permitted.
     */
    public record ThrottleResult(boolean permitted, Duration retryAfter) {

        static ThrottleResult allow() {
            return new ThrottleResult(true, null);
        }

        static ThrottleResult block(Duration retryAfter) {
            return new ThrottleResult(false, retryAfter);
        }
    }

    /**
     * Stored as "count|lockedUntilMillis".
     */
    private static final class AttemptEntry {
        int failureCount;
        Instant lockedUntil;

        AttemptEntry(int failureCount, Instant lockedUntil) {
            this.failureCount = failureCount;
            this.lockedUntil = lockedUntil;
        }

        String serialize() {
            return failureCount + "|" + (lockedUntil != null ? lockedUntil.toEpochMilli() : "");
        }

        static AttemptEntry parse(String data) {
            String[] parts = data.split("\\|", -1);
            int count = Integer.parseInt(parts[0]);
            Instant lockedUntil = parts.length > 1 && !parts[1].isEmpty()
                ? Instant.ofEpochMilli(Long.parseLong(parts[1]))
                : null;
            return new AttemptEntry(count, lockedUntil);
        }
    }
}
