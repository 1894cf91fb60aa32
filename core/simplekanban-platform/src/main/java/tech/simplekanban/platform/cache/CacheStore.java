package tech.simplekanban.platform.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Namespaced string store for short-lived security state: revoked session ids and failed login counters.
 * Backed by Caffeine ({@link CacheType#MEMORY}) or Redis ({@link CacheType#REDIS}), chosen through
 * {@code simplekanban.cache.type}.
 */
public interface CacheStore {

    /** Empty when the key was never stored or its entry has expired. */
    Optional<String> get(String cacheName, String key);

    /** Stores with {@code simplekanban.cache.ttl}. */
    void put(String cacheName, String key, String value);

    void put(String cacheName, String key, String value, Duration ttl);

    void invalidate(String cacheName, String key);

    void invalidateAll(String cacheName);

    enum CacheType {
        MEMORY,
        REDIS
    }
}
