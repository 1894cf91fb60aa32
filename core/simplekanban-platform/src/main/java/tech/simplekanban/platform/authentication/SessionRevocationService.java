package tech.simplekanban.platform.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.simplekanban.platform.cache.CacheStore;

import java.time.Clock;
import java.time.Duration;

/**
 * Denylist of logged-out session ids, held in the cache until the token would have expired.
 *
 * <p>Cache failures fail open: signature and expiry checks still apply, so a cache outage
 * only re-admits logged-out tokens until their natural expiry.
 */
@ApplicationScoped
public class SessionRevocationService {

    private static final Logger LOG = Logger.getLogger(SessionRevocationService.class);
    static final String CACHE_NAME = "revoked-sessions";

    @Inject
    AuthConfig authConfig;

    @Inject
    CacheStore cacheStore;

    @Inject
    Clock clock;

    public void revoke(SessionClaims claims) {
        if (!authConfig.session().revocationEnabled()) {
            return;
        }
        Duration remaining = Duration.between(clock.instant(), claims.expiresAt());
        if (remaining.isNegative() || remaining.isZero()) {
            return;
        }
        try {
            cacheStore.put(CACHE_NAME, claims.sessionId(), claims.userId(), remaining);
            LOG.debugf("Revoked session %s for user %s", claims.sessionId(), claims.userId());
        } catch (RuntimeException e) {
            LOG.warnf("Failed to record revoked session %s: %s", claims.sessionId(), e.getMessage());
        }
    }

    public boolean isRevoked(String sessionId) {
        if (!authConfig.session().revocationEnabled() || sessionId == null) {
            return false;
        }
        try {
            return cacheStore.get(CACHE_NAME, sessionId).isPresent();
        } catch (RuntimeException e) {
            LOG.warnf("Revocation lookup failed, treating session as not revoked: %s", e.getMessage());
            return false;
        }
    }
}
