package tech.simplekanban.platform.apikey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for API keys.
 */
public interface ApiKeyRepository {

    // Read operations
    Optional<ApiKey> findKeyById(String id);
    List<ApiKey> findByLookupPrefix(String lookupPrefix);
    List<ApiKey> findByUserId(String userId);

    // Write operations
    void insert(ApiKey apiKey);
    void save(ApiKey apiKey);
    boolean deleteKey(String id);

    /**
     * Set last-used time and increment the usage counter in a single statement.
     */
    void recordUsage(String id, Instant usedAt);
}
