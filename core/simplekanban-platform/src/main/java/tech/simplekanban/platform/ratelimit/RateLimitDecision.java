package tech.simplekanban.platform.ratelimit;

import java.time.Duration;

/**
 * Result of a rate limit check.
 *
 * @param allowed    whether the request may proceed
 * @param limit      the configured ceiling
 * @param remaining  requests left in the current window after this one
 * @param retryAfter when denied, how long the client should wait (one full window)
 */
public record RateLimitDecision(boolean allowed, int limit, int remaining, Duration retryAfter) {

    public static RateLimitDecision allow(int limit, int remaining) {
        return new RateLimitDecision(true, limit, remaining, Duration.ZERO);
    }

    public static RateLimitDecision deny(int limit, Duration retryAfter) {
        return new RateLimitDecision(false, limit, 0, retryAfter);
    }
}
