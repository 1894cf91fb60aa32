package tech.simplekanban.platform.ratelimit;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Configuration for request rate limiting.
 *
 * <p>The shared cache is used when {@code quarkus.redis.hosts} is set; otherwise the
 * limiter runs in-process for the lifetime of the application.
 */
@ConfigMapping(prefix = "simplekanban.rate-limit")
public interface RateLimitConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * Length of the sliding window.
     */
    @WithDefault("PT60S")
    Duration window();

    /**
     * Requests allowed per client within one window.
     */
    @WithName("max-requests")
    @WithDefault("100")
    int maxRequests();

    /**
     * Upper bound on a single shared-cache round trip before falling back in-process.
     */
    @WithName("cache-timeout")
    @WithDefault("PT0.05S")
    Duration cacheTimeout();

    @WithName("key-prefix")
    @WithDefault("kanban:ratelimit:")
    String keyPrefix();

    /**
     * Maximum number of client windows held by the in-process limiter.
     */
    @WithName("max-tracked-clients")
    @WithDefault("100000")
    long maxTrackedClients();

    /**
     * Paths (exact, or prefix when ending in '/*') that are never counted.
     */
    @WithName("exempt-paths")
    @WithDefault("/q/health/*,/q/openapi,/static/*")
    List<String> exemptPaths();

    /**
     * Addresses or CIDR ranges of reverse proxies whose X-Forwarded-For header is trusted.
     */
    @WithName("trusted-proxies")
    Optional<List<String>> trustedProxies();
}
