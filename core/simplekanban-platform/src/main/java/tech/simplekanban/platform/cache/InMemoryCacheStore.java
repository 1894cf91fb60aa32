package tech.simplekanban.platform.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * One Caffeine cache per namespace; each entry expires after the TTL it was stored with.
 * A revocation recorded here is invisible to other replicas.
 *
 * <p>{@code @Typed} keeps this bean out of {@link CacheStore} resolution; {@link CacheStoreProducer} exposes it.
 */
@Singleton
@Typed(InMemoryCacheStore.class)
public class InMemoryCacheStore implements CacheStore {

    @Inject
    CacheConfig config;

    private final ConcurrentMap<String, Cache<String, Entry>> caches = new ConcurrentHashMap<>();

    private record Entry(String value, Duration ttl) {}

    private Cache<String, Entry> namespace(String cacheName) {
        return caches.computeIfAbsent(cacheName, name ->
            Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build()
        );
    }

    @Override
    public Optional<String> get(String cacheName, String key) {
        return Optional.ofNullable(namespace(cacheName).getIfPresent(key)).map(Entry::value);
    }

    @Override
    public void put(String cacheName, String key, String value) {
        put(cacheName, key, value, config.ttl());
    }

    @Override
    public void put(String cacheName, String key, String value, Duration ttl) {
        namespace(cacheName).put(key, new Entry(value, ttl));
    }

    @Override
    public void invalidate(String cacheName, String key) {
        namespace(cacheName).invalidate(key);
    }

    @Override
    public void invalidateAll(String cacheName) {
        Cache<String, Entry> cache = caches.get(cacheName);
        if (cache != null) {
            cache.invalidateAll();
        }
    }
}
