package tech.simplekanban.platform.ratelimit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Reports which backend is enforcing request limits.
 * Stays UP while degraded: the in-process fallback still enforces the ceiling, only per replica.
 */
@ApplicationScoped
@Readiness
public class RateLimiterHealthCheck implements HealthCheck {

    @Inject
    RateLimitConfig config;

    @Inject
    RateLimiter rateLimiter;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("RateLimiter").up();

        if (!config.enabled()) {
            return builder.withData("mode", "disabled").build();
        }

        builder.withData("maxRequests", config.maxRequests())
            .withData("window", config.window().toString());

        if (rateLimiter instanceof FailoverRateLimiter failover) {
            return builder
                .withData("mode", failover.isDegraded() ? "in-process-fallback" : "redis")
                .build();
        }
        return builder.withData("mode", "in-process").build();
    }
}
