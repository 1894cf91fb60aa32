package tech.simplekanban.platform.cache;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Settings for the store behind session revocation and login throttling.
 */
@ConfigMapping(prefix = "simplekanban.cache")
public interface CacheConfig {

    /** MEMORY keeps state per process, REDIS shares it across replicas. */
    @WithDefault("MEMORY")
    CacheStore.CacheType type();

    /** Applied when a caller stores an entry without its own expiry. */
    @WithDefault("5m")
    Duration ttl();

    /** Upper bound on entries held by each in-process cache. */
    @WithDefault("10000")
    long maxSize();

    Redis redis();

    interface Redis {
        /** Namespace prepended to every key written to Redis. */
        @WithDefault("kanban:cache:")
        String keyPrefix();
    }
}
