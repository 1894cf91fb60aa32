package tech.simplekanban.platform.apikey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A long-lived programmatic credential. Only a keyed hash of the secret is stored;
 * the plaintext is returned once, at creation.
 */
public class ApiKey {

    public String id;

    public String userId;

    public String name;

    public String description;

    /** First characters of the plaintext, shown in listings so users can tell keys apart. */
    public String keyPrefix;

    /** Leading hex characters of {@link #secretHash}; indexed for lookup. */
    public String lookupPrefix;

    public String secretHash;

    /** Scope values in issuance order; never changed after creation. */
    public List<String> scopes = new ArrayList<>();

    public Instant expiresAt;

    public boolean active = true;

    public Instant createdAt;

    public Instant lastUsedAt;

    public long usageCount;

    public ApiKey() {
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
