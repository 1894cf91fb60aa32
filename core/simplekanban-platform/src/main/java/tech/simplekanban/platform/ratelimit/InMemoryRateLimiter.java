package tech.simplekanban.platform.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * In-process sliding-log rate limiter backed by Caffeine.
 *
 * <p>Each client key owns a window of request timestamps; checks on the same key are
 * serialized on that window, so concurrent requests cannot under-count. Idle windows
 * are evicted after one window length.
 *
 * <p>A denied request is told to retry after one full window, the same value for every
 * denial, so clients backing off never see the hint shrink while they are throttled.
 *
 * <p>Counts are per instance: with several instances a client can get up to
 * N times the ceiling while this limiter is in use.
 *
 * <p>Note: @Typed keeps this bean from satisfying RateLimiter injection points directly;
 * RateLimiterProducer decides which limiter is used.
 */
@Singleton
@Typed(InMemoryRateLimiter.class)
public class InMemoryRateLimiter implements RateLimiter {

    private final int maxRequests;
    private final long windowMillis;
    private final Clock clock;
    private final Cache<String, SlidingWindow> windows;

    @Inject
    public InMemoryRateLimiter(RateLimitConfig config, Clock clock) {
        this(config.maxRequests(), config.window(), config.maxTrackedClients(), clock);
    }

    public InMemoryRateLimiter(int maxRequests, Duration window, long maxTrackedClients, Clock clock) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        this.maxRequests = maxRequests;
        this.windowMillis = window.toMillis();
        this.clock = clock;
        this.windows = Caffeine.newBuilder()
            .expireAfterAccess(window)
            .maximumSize(maxTrackedClients)
            .build();
    }

    @Override
    public RateLimitDecision check(String clientKey) {
        SlidingWindow window = windows.get(clientKey, k -> new SlidingWindow());
        return window.tryAcquire(clock.millis());
    }

    private final class SlidingWindow {

        private final Deque<Long> timestamps = new ArrayDeque<>();

        synchronized RateLimitDecision tryAcquire(long now) {
            long cutoff = now - windowMillis;
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
                timestamps.pollFirst();
            }

            if (timestamps.size() >= maxRequests) {
                return RateLimitDecision.deny(maxRequests, Duration.ofMillis(windowMillis));
            }

            timestamps.addLast(now);
            return RateLimitDecision.allow(maxRequests, maxRequests - timestamps.size());
        }
    }
}
