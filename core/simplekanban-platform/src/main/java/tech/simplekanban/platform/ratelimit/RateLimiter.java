package tech.simplekanban.platform.ratelimit;

/**
 * Sliding-window request counter.
 *
 * <p>Each call to {@link #check(String)} both tests and records the request: an allowed
 * request counts against the window, a denied one does not.
 */
public interface RateLimiter {

    RateLimitDecision check(String clientKey);
}
