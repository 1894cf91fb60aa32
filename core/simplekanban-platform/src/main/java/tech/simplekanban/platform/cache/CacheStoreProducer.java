package tech.simplekanban.platform.cache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Picks the backend that holds revoked sessions and login-throttle counters.
 *
 * <p>Only the chosen backend is instantiated, so a MEMORY deployment never opens a Redis connection.
 */
@ApplicationScoped
public class CacheStoreProducer {

    private static final Logger LOG = Logger.getLogger(CacheStoreProducer.class);

    @Inject
    CacheConfig config;

    @Inject
    Instance<InMemoryCacheStore> memoryBackend;

    @Inject
    Instance<RedisCacheStore> redisBackend;

    @Produces
    @ApplicationScoped
    public CacheStore cacheStore() {
        CacheStore.CacheType backend = config.type();
        LOG.infof("Auth state cache backend=%s defaultTtl=%s", backend, config.ttl());

        if (backend == CacheStore.CacheType.REDIS) {
            LOG.info("Revocations and login throttles are shared through Redis");
            return redisBackend.get();
        }
        LOG.infof("Revocations and login throttles are local to this process (max %d entries per cache)",
            config.maxSize());
        return memoryBackend.get();
    }
}
