package tech.simplekanban.platform.ratelimit;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.faulttolerance.api.CircuitBreakerName;
import io.vertx.mutiny.redis.client.Response;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import tech.simplekanban.platform.shared.TsidGenerator;

import java.time.Clock;
import java.time.Duration;

/**
 * Rate limiter backed by Redis, shared by all service instances.
 *
 * <p>Each client key is a sorted set of request timestamps. A Lua script trims entries
 * older than the window, counts the rest and records the new request in one atomic step.
 * Every call is bounded by the configured cache timeout; failures surface as
 * {@link RateLimitStoreUnavailableException} for {@link FailoverRateLimiter} to absorb.
 * While the circuit is open calls fail immediately instead of waiting on a dead connection.
 */
@Singleton
@Typed(RedisRateLimiter.class)
public class RedisRateLimiter implements RateLimiter {

    /**
     * KEYS[1] = window key
     * ARGV[1] = now (ms), ARGV[2] = window (ms), ARGV[3] = limit, ARGV[4] = unique member
     * Returns {allowed, remaining, retryAfterMs}; a denial always retries after one window.
     */
    static final String SLIDING_WINDOW_SCRIPT = """
        local now = tonumber(ARGV[1])
        local window = tonumber(ARGV[2])
        local limit = tonumber(ARGV[3])
        redis.call("ZREMRANGEBYSCORE", KEYS[1], "-inf", now - window)
        local count = redis.call("ZCARD", KEYS[1])
        if count < limit then
            redis.call("ZADD", KEYS[1], now, ARGV[4])
            redis.call("PEXPIRE", KEYS[1], window)
            return {1, limit - count - 1, 0}
        end
        return {0, 0, window}
        """;

    private final ReactiveRedisDataSource redis;
    private final RateLimitConfig config;
    private final Clock clock;

    @Inject
    public RedisRateLimiter(ReactiveRedisDataSource redis, RateLimitConfig config, Clock clock) {
        this.redis = redis;
        this.config = config;
        this.clock = clock;
    }

    @Override
    @CircuitBreaker(requestVolumeThreshold = 10, failureRatio = 0.5, delay = 5000, successThreshold = 2,
        failOn = RateLimitStoreUnavailableException.class)
    @CircuitBreakerName("rate-limit-cache")
    public RateLimitDecision check(String clientKey) {
        long now = clock.millis();
        long windowMillis = config.window().toMillis();
        int limit = config.maxRequests();

        Response result;
        try {
            result = redis.execute("EVAL", SLIDING_WINDOW_SCRIPT, "1",
                    config.keyPrefix() + clientKey,
                    Long.toString(now),
                    Long.toString(windowMillis),
                    Integer.toString(limit),
                    now + ":" + TsidGenerator.generateRaw())
                .await().atMost(config.cacheTimeout());
        } catch (RuntimeException e) {
            throw new RateLimitStoreUnavailableException("Rate limit store unavailable: " + e.getMessage(), e);
        }

        if (result == null || result.size() < 3) {
            throw new RateLimitStoreUnavailableException("Unexpected rate limit script result", null);
        }
        if (result.get(0).toInteger() == 1) {
            return RateLimitDecision.allow(limit, result.get(1).toInteger());
        }
        return RateLimitDecision.deny(limit, Duration.ofMillis(Math.max(result.get(2).toLong(), 1)));
    }
}
