package tech.simplekanban.platform.ratelimit;

import org.jboss.logging.Logger;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Uses the shared-cache limiter while it answers and the in-process limiter whenever it
 * does not. Requests are never allowed unconditionally because the cache is down.
 *
 * <p>Degraded mode is logged on entry and exit only, never reported to clients.
 */
public class FailoverRateLimiter implements RateLimiter {

    private static final Logger LOG = Logger.getLogger(FailoverRateLimiter.class);

    private final RateLimiter primary;
    private final RateLimiter fallback;
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    public FailoverRateLimiter(RateLimiter primary, RateLimiter fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public RateLimitDecision check(String clientKey) {
        try {
            RateLimitDecision decision = primary.check(clientKey);
            if (degraded.compareAndSet(true, false)) {
                LOG.info("Rate limit cache reachable again, leaving in-process fallback");
            }
            return decision;
        } catch (RuntimeException e) {
            if (degraded.compareAndSet(false, true)) {
                LOG.warnf("Rate limit cache unavailable, using in-process fallback: %s", e.getMessage());
            } else {
                LOG.debugf("Rate limit cache still unavailable: %s", e.getMessage());
            }
            return fallback.check(clientKey);
        }
    }

    public boolean isDegraded() {
        return degraded.get();
    }
}
