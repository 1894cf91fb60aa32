package tech.simplekanban.platform.apikey;

import java.time.Instant;
import java.util.List;

/**
 * Usage summary over one user's API keys.
 */
public record ApiKeyUsageStats(
    int totalKeys,
    int activeKeys,
    int expiredKeys,
    long totalRequests,
    List<KeyUsage> mostUsed,
    List<KeyUsage> recentlyUsed
) {

    public record KeyUsage(String id, String name, String keyPrefix, long usageCount, Instant lastUsedAt) {

        static KeyUsage of(ApiKey key) {
            return new KeyUsage(key.id, key.name, key.keyPrefix, key.usageCount, key.lastUsedAt);
        }
    }
}
