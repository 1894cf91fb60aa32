package tech.simplekanban.platform.ratelimit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * CDI producer that selects the RateLimiter implementation at startup.
 *
 * <ul>
 *   <li>{@code quarkus.redis.hosts} set: Redis, falling back in-process when it fails</li>
 *   <li>not set: in-process only, permanently</li>
 * </ul>
 */
@ApplicationScoped
public class RateLimiterProducer {

    private static final Logger LOG = Logger.getLogger(RateLimiterProducer.class);

    @Inject
    RateLimitConfig config;

    @ConfigProperty(name = "quarkus.redis.hosts")
    Optional<String> redisHosts;

    @Inject
    Instance<InMemoryRateLimiter> inMemoryRateLimiter;

    @Inject
    Instance<RedisRateLimiter> redisRateLimiter;

    @Produces
    @Singleton
    public RateLimiter rateLimiter() {
        if (!config.enabled()) {
            LOG.info("Rate limiting is disabled");
            return clientKey -> RateLimitDecision.allow(config.maxRequests(), config.maxRequests());
        }

        LOG.infof("Initializing rate limiter: %d requests per %s", config.maxRequests(), config.window());

        if (redisHosts.isPresent() && !redisHosts.get().isBlank()) {
            LOG.info("Using Redis rate limiter with in-process fallback");
            return new FailoverRateLimiter(redisRateLimiter.get(), inMemoryRateLimiter.get());
        }

        LOG.info("No rate limit cache configured, using in-process rate limiter");
        return inMemoryRateLimiter.get();
    }
}
