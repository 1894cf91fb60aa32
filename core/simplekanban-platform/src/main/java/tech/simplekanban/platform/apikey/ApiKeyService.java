package tech.simplekanban.platform.apikey;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.simplekanban.platform.authentication.AuthConfig;
import tech.simplekanban.platform.common.Result;
import tech.simplekanban.platform.common.errors.UseCaseError;
import tech.simplekanban.platform.identity.AuthFailure;
import tech.simplekanban.platform.identity.CredentialRejectedException;
import tech.simplekanban.platform.identity.Principal;
import tech.simplekanban.platform.shared.EntityType;
import tech.simplekanban.platform.shared.TsidGenerator;
import tech.simplekanban.platform.user.User;
import tech.simplekanban.platform.user.UserRepository;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Issues, validates and manages API keys.
 *
 * <p>Key format: {@code sk_} followed by the unpadded base64url encoding of 32 random bytes.
 */
@ApplicationScoped
public class ApiKeyService {

    private static final Logger LOG = Logger.getLogger(ApiKeyService.class);

    public static final String KEY_PREFIX = "sk_";
    static final int SECRET_BYTES = 32;
    static final int DISPLAY_PREFIX_LENGTH = 8;
    private static final int ENCODED_SECRET_LENGTH = 43;
    private static final Pattern KEY_PATTERN = Pattern.compile("^sk_[A-Za-z0-9_-]{" + ENCODED_SECRET_LENGTH + "}$");
    private static final int MAX_NAME_LENGTH = 100;
    private static final int STATS_LIST_SIZE = 5;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    @Inject
    ApiKeyRepository apiKeyRepository;

    @Inject
    UserRepository userRepository;

    @Inject
    ApiKeyHasher hasher;

    @Inject
    AuthConfig authConfig;

    @Inject
    Clock clock;

    /** Compared against when the lookup prefix matches nothing, keeping the miss path the same shape. */
    private volatile String dummyHash;

    // ==================== Issuance ====================

    /**
     * Create a key for the owner. Scope values are de-duplicated, kept in request order and
     * must not exceed what the owner may do: only administrators may hold the admin scope.
     *
     * @param expiresInDays lifetime in days, or null for a key that never expires
     */
    @Transactional
    public Result<IssuedApiKey> issue(User owner, String name, String description,
                                      List<String> scopes, Integer expiresInDays) {
        if (name == null || name.isBlank() || name.length() > MAX_NAME_LENGTH) {
            return Result.failure(new UseCaseError.ValidationError("INVALID_NAME",
                "Name is required and must be at most " + MAX_NAME_LENGTH + " characters"));
        }
        if (expiresInDays != null && (expiresInDays < 1 || expiresInDays > authConfig.apiKey().maxExpiryDays())) {
            return Result.failure(new UseCaseError.ValidationError("INVALID_EXPIRY",
                "expiresInDays must be between 1 and " + authConfig.apiKey().maxExpiryDays()));
        }

        Set<String> normalized = new LinkedHashSet<>();
        for (String requested : scopes == null ? List.<String>of() : scopes) {
            Optional<ApiKeyScope> scope = ApiKeyScope.fromValue(requested);
            if (scope.isEmpty()) {
                return Result.failure(new UseCaseError.ValidationError("INVALID_SCOPES",
                    "Unknown scope", Map.of("scope", String.valueOf(requested))));
            }
            normalized.add(scope.get().value());
        }
        if (normalized.isEmpty()) {
            return Result.failure(new UseCaseError.ValidationError("INVALID_SCOPES", "At least one scope is required"));
        }
        if (normalized.contains(ApiKeyScope.ADMIN.value()) && !owner.admin) {
            return Result.failure(new UseCaseError.AuthorizationError("INVALID_SCOPES",
                "Requested scopes exceed the owner's permissions"));
        }

        String plaintext = generateSecret();
        String hash = hasher.hash(plaintext);
        Instant now = clock.instant();

        ApiKey key = new ApiKey();
        key.id = TsidGenerator.generate(EntityType.API_KEY);
        key.userId = owner.id;
        key.name = name.trim();
        key.description = description;
        key.keyPrefix = plaintext.substring(0, DISPLAY_PREFIX_LENGTH);
        key.secretHash = hash;
        key.lookupPrefix = ApiKeyHasher.lookupPrefix(hash);
        key.scopes = new ArrayList<>(normalized);
        key.expiresAt = expiresInDays == null ? null : now.plus(Duration.ofDays(expiresInDays));
        key.active = true;
        key.createdAt = now;
        key.usageCount = 0;

        apiKeyRepository.insert(key);
        LOG.infof("Issued API key %s (%s...) for user %s with scopes %s", key.id, key.keyPrefix, owner.id, key.scopes);
        return Result.success(new IssuedApiKey(key, plaintext));
    }

    // ==================== Validation ====================

    /**
     * Resolve a presented secret to its owner.
     *
     * @throws CredentialRejectedException with MALFORMED, KEY_NOT_FOUND, EXPIRED, INACTIVE or OWNER_INACTIVE
     */
    public ValidatedApiKey validate(String presented) {
        if (presented == null || !KEY_PATTERN.matcher(presented).matches()) {
            throw new CredentialRejectedException(AuthFailure.MALFORMED);
        }

        String hash = hasher.hash(presented);
        List<ApiKey> candidates = apiKeyRepository.findByLookupPrefix(ApiKeyHasher.lookupPrefix(hash));

        ApiKey match = null;
        if (candidates.isEmpty()) {
            ApiKeyHasher.matches(hash, dummyHash());
        }
        for (ApiKey candidate : candidates) {
            // Visit every candidate so the work done does not depend on which one matches
            if (ApiKeyHasher.matches(hash, candidate.secretHash) && match == null) {
                match = candidate;
            }
        }
        if (match == null) {
            throw new CredentialRejectedException(AuthFailure.KEY_NOT_FOUND);
        }

        if (match.isExpired(clock.instant())) {
            throw new CredentialRejectedException(AuthFailure.EXPIRED);
        }
        if (!match.active) {
            throw new CredentialRejectedException(AuthFailure.INACTIVE);
        }

        Optional<User> owner = userRepository.findByIdOptional(match.userId);
        if (owner.isEmpty() || !owner.get().active) {
            throw new CredentialRejectedException(AuthFailure.OWNER_INACTIVE);
        }

        Principal principal = Principal.apiKey(owner.get().id, owner.get().admin, match.scopes, match.id);
        return new ValidatedApiKey(match, principal);
    }

    // ==================== Management ====================

    public List<ApiKey> listForUser(String userId) {
        return apiKeyRepository.findByUserId(userId);
    }

    public Optional<ApiKey> findById(String keyId) {
        return apiKeyRepository.findKeyById(keyId);
    }

    /**
     * Update the name, description or active flag. Scopes cannot be changed after issuance.
     * Null arguments leave the field unchanged.
     */
    @Transactional
    public Result<ApiKey> update(String keyId, String name, String description, Boolean active) {
        Optional<ApiKey> found = apiKeyRepository.findKeyById(keyId);
        if (found.isEmpty()) {
            return Result.failure(keyNotFound(keyId));
        }

        ApiKey key = found.get();
        if (name != null) {
            if (name.isBlank() || name.length() > MAX_NAME_LENGTH) {
                return Result.failure(new UseCaseError.ValidationError("INVALID_NAME",
                    "Name must be between 1 and " + MAX_NAME_LENGTH + " characters"));
            }
            key.name = name.trim();
        }
        if (description != null) {
            key.description = description;
        }
        if (active != null) {
            key.active = active;
        }

        apiKeyRepository.save(key);
        LOG.infof("Updated API key %s (active=%s)", key.id, key.active);
        return Result.success(key);
    }

    @Transactional
    public Result<String> delete(String keyId) {
        if (!apiKeyRepository.deleteKey(keyId)) {
            return Result.failure(keyNotFound(keyId));
        }
        LOG.infof("Deleted API key %s", keyId);
        return Result.success(keyId);
    }

    public ApiKeyUsageStats usageStats(String userId) {
        List<ApiKey> keys = apiKeyRepository.findByUserId(userId);
        Instant now = clock.instant();

        int active = 0;
        int expired = 0;
        long totalRequests = 0;
        for (ApiKey key : keys) {
            if (key.isExpired(now)) {
                expired++;
            } else if (key.active) {
                active++;
            }
            totalRequests += key.usageCount;
        }

        List<ApiKeyUsageStats.KeyUsage> mostUsed = keys.stream()
            .filter(k -> k.usageCount > 0)
            .sorted(Comparator.comparingLong((ApiKey k) -> k.usageCount).reversed())
            .limit(STATS_LIST_SIZE)
            .map(ApiKeyUsageStats.KeyUsage::of)
            .toList();
        List<ApiKeyUsageStats.KeyUsage> recentlyUsed = keys.stream()
            .filter(k -> k.lastUsedAt != null)
            .sorted(Comparator.comparing((ApiKey k) -> k.lastUsedAt).reversed())
            .limit(STATS_LIST_SIZE)
            .map(ApiKeyUsageStats.KeyUsage::of)
            .toList();

        return new ApiKeyUsageStats(keys.size(), active, expired, totalRequests, mostUsed, recentlyUsed);
    }

    static String generateSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return KEY_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private String dummyHash() {
        String hash = dummyHash;
        if (hash == null) {
            hash = hasher.hash(generateSecret());
            dummyHash = hash;
        }
        return hash;
    }

    private static UseCaseError keyNotFound(String keyId) {
        return new UseCaseError.NotFoundError("API_KEY_NOT_FOUND", "API key not found", Map.of("keyId", keyId));
    }

    /**
     * A validated key and the principal it resolves to.
     */
    public record ValidatedApiKey(ApiKey apiKey, Principal principal) {
    }
}
