package tech.simplekanban.platform.apikey.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.simplekanban.platform.apikey.ApiKey;
import tech.simplekanban.platform.apikey.ApiKeyRepository;
import tech.simplekanban.platform.apikey.entity.ApiKeyEntity;
import tech.simplekanban.platform.apikey.mapper.ApiKeyMapper;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of ApiKeyRepository.
 */
@ApplicationScoped
@Transactional
public class PanacheApiKeyRepository implements ApiKeyRepository, PanacheRepositoryBase<ApiKeyEntity, String> {

    @Override
    public Optional<ApiKey> findKeyById(String id) {
        return Optional.ofNullable(ApiKeyMapper.toDomain(findById(id)));
    }

    @Override
    public List<ApiKey> findByLookupPrefix(String lookupPrefix) {
        return list("lookupPrefix", lookupPrefix).stream()
            .map(ApiKeyMapper::toDomain)
            .toList();
    }

    @Override
    public List<ApiKey> findByUserId(String userId) {
        return list("userId = ?1 ORDER BY createdAt DESC", userId).stream()
            .map(ApiKeyMapper::toDomain)
            .toList();
    }

    @Override
    public void insert(ApiKey apiKey) {
        persist(ApiKeyMapper.toEntity(apiKey));
    }

    @Override
    public void save(ApiKey apiKey) {
        ApiKeyEntity entity = findById(apiKey.id);
        if (entity != null) {
            ApiKeyMapper.updateEntity(entity, apiKey);
        }
    }

    @Override
    public boolean deleteKey(String id) {
        return deleteById(id);
    }

    @Override
    public void recordUsage(String id, Instant usedAt) {
        update("lastUsedAt = ?1, usageCount = usageCount + 1 WHERE id = ?2", usedAt, id);
    }
}
