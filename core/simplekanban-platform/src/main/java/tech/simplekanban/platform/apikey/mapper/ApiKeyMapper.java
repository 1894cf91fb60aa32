package tech.simplekanban.platform.apikey.mapper;

import tech.simplekanban.platform.apikey.ApiKey;
import tech.simplekanban.platform.apikey.entity.ApiKeyEntity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Mapper for converting between the ApiKey domain model and its JPA entity.
 */
public final class ApiKeyMapper {

    private static final String SCOPE_SEPARATOR = ",";

    private ApiKeyMapper() {
    }

    public static ApiKey toDomain(ApiKeyEntity entity) {
        if (entity == null) {
            return null;
        }

        ApiKey key = new ApiKey();
        key.id = entity.id;
        key.userId = entity.userId;
        key.name = entity.name;
        key.description = entity.description;
        key.keyPrefix = entity.keyPrefix;
        key.lookupPrefix = entity.lookupPrefix;
        key.secretHash = entity.secretHash;
        key.scopes = splitScopes(entity.scopes);
        key.expiresAt = entity.expiresAt;
        key.active = entity.active;
        key.createdAt = entity.createdAt;
        key.lastUsedAt = entity.lastUsedAt;
        key.usageCount = entity.usageCount;
        return key;
    }

    public static ApiKeyEntity toEntity(ApiKey key) {
        if (key == null) {
            return null;
        }

        ApiKeyEntity entity = new ApiKeyEntity();
        entity.id = key.id;
        entity.userId = key.userId;
        entity.keyPrefix = key.keyPrefix;
        entity.lookupPrefix = key.lookupPrefix;
        entity.secretHash = key.secretHash;
        entity.scopes = String.join(SCOPE_SEPARATOR, key.scopes);
        entity.createdAt = key.createdAt;
        entity.usageCount = key.usageCount;
        entity.lastUsedAt = key.lastUsedAt;
        updateEntity(entity, key);
        return entity;
    }

    /**
     * Copy the mutable fields. Scopes, hashes and ownership are fixed at issuance.
     */
    public static void updateEntity(ApiKeyEntity entity, ApiKey key) {
        entity.name = key.name;
        entity.description = key.description;
        entity.expiresAt = key.expiresAt;
        entity.active = key.active;
    }

    static List<String> splitScopes(String scopes) {
        if (scopes == null || scopes.isBlank()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.stream(scopes.split(SCOPE_SEPARATOR))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList());
    }
}
