package tech.simplekanban.platform.apikey.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for the api_keys table. Scopes are stored comma-separated in issuance order.
 */
@Entity
@Table(name = "api_keys", indexes = {
    @Index(name = "idx_api_keys_lookup_prefix", columnList = "lookup_prefix"),
    @Index(name = "idx_api_keys_user_id", columnList = "user_id")
})
public class ApiKeyEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "user_id", nullable = false, length = 17)
    public String userId;

    @Column(name = "name", nullable = false, length = 100)
    public String name;

    @Column(name = "description", length = 500)
    public String description;

    @Column(name = "key_prefix", nullable = false, length = 8)
    public String keyPrefix;

    @Column(name = "lookup_prefix", nullable = false, length = 16)
    public String lookupPrefix;

    @Column(name = "secret_hash", nullable = false, unique = true, length = 64)
    public String secretHash;

    @Column(name = "scopes", nullable = false)
    public String scopes;

    @Column(name = "expires_at")
    public Instant expiresAt;

    @Column(name = "active", nullable = false)
    public boolean active;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "last_used_at")
    public Instant lastUsedAt;

    @Column(name = "usage_count", nullable = false)
    public long usageCount;

    public ApiKeyEntity() {
    }
}
