package tech.simplekanban.platform.cache;

import io.quarkus.arc.lookup.LookupIfProperty;
import io.quarkus.redis.datasource.RedisDataSource;
import io.quarkus.redis.datasource.keys.KeyCommands;
import io.quarkus.redis.datasource.value.ValueCommands;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis store for revocations and login throttles, so every replica sees the same state.
 * Entries are written with SETEX; sub-second TTLs round up to one second.
 *
 * <p>Active only with {@code simplekanban.cache.type=REDIS}; reached through {@link CacheStoreProducer}.
 */
@Singleton
@Typed(RedisCacheStore.class)
@LookupIfProperty(name = "simplekanban.cache.type", stringValue = "REDIS")
public class RedisCacheStore implements CacheStore {

    private final CacheConfig config;
    private final ValueCommands<String, String> values;
    private final KeyCommands<String> keys;

    @Inject
    public RedisCacheStore(RedisDataSource redis, CacheConfig config) {
        this.config = config;
        this.values = redis.value(String.class, String.class);
        this.keys = redis.key(String.class);
    }

    private String redisKey(String cacheName, String key) {
        return config.redis().keyPrefix() + cacheName + ":" + key;
    }

    @Override
    public Optional<String> get(String cacheName, String key) {
        return Optional.ofNullable(values.get(redisKey(cacheName, key)));
    }

    @Override
    public void put(String cacheName, String key, String value) {
        put(cacheName, key, value, config.ttl());
    }

    @Override
    public void put(String cacheName, String key, String value, Duration ttl) {
        long seconds = Math.max(1, ttl.toSeconds());
        values.setex(redisKey(cacheName, key), seconds, value);
    }

    @Override
    public void invalidate(String cacheName, String key) {
        keys.del(redisKey(cacheName, key));
    }

    @Override
    public void invalidateAll(String cacheName) {
        List<String> matching = keys.keys(config.redis().keyPrefix() + cacheName + ":*");
        if (!matching.isEmpty()) {
            keys.del(matching.toArray(new String[0]));
        }
    }
}
