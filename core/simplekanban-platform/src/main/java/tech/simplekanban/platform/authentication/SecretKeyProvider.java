package tech.simplekanban.platform.authentication;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.simplekanban.platform.common.errors.ConfigurationException;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * Holds the server-side secrets: the session token signing key and the API key hashing key.
 *
 * Supports two modes:
 * 1. Configured secrets (production) - must be at least 32 bytes, otherwise startup fails
 * 2. Generated secrets (development, only with allow-generated-secrets=true) - created on
 *    first start and persisted to the dev secret directory so sessions survive restarts
 */
@Startup
@ApplicationScoped
public class SecretKeyProvider {

    private static final Logger LOG = Logger.getLogger(SecretKeyProvider.class);

    public static final int MIN_SECRET_BYTES = 32;
    static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String BASE64_PREFIX = "base64:";
    private static final int MIN_DISTINCT_BYTES = 8;

    @Inject
    AuthConfig authConfig;

    private SecretKey signingKey;
    private SecretKey apiKeyHashKey;

    @PostConstruct
    void init() {
        this.signingKey = resolve("simplekanban.auth.session.signing-secret",
            authConfig.session().signingSecret(), "session-signing.key");
        this.apiKeyHashKey = resolve("simplekanban.auth.api-key.hash-secret",
            authConfig.apiKey().hashSecret(), "api-key-hash.key");
        LOG.info("Secret keys initialized");
    }

    /**
     * Build a provider from already-known key material, bypassing configuration.
     */
    public static SecretKeyProvider of(byte[] signingSecret, byte[] apiKeyHashSecret) {
        requireStrong("signing secret", signingSecret);
        requireStrong("API key hash secret", apiKeyHashSecret);
        SecretKeyProvider provider = new SecretKeyProvider();
        provider.signingKey = new SecretKeySpec(signingSecret, HMAC_ALGORITHM);
        provider.apiKeyHashKey = new SecretKeySpec(apiKeyHashSecret, HMAC_ALGORITHM);
        return provider;
    }

    public SecretKey signingKey() {
        return signingKey;
    }

    public SecretKey apiKeyHashKey() {
        return apiKeyHashKey;
    }

    private SecretKey resolve(String property, Optional<String> configured, String devFileName) {
        if (configured.isPresent() && !configured.get().isBlank()) {
            byte[] bytes = decode(property, configured.get());
            if (isStrong(bytes)) {
                return new SecretKeySpec(bytes, HMAC_ALGORITHM);
            }
            if (!authConfig.allowGeneratedSecrets()) {
                LOG.errorf("%s is weaker than %d bytes of key material; refusing to start", property, MIN_SECRET_BYTES);
                throw new ConfigurationException(property + " must contain at least " + MIN_SECRET_BYTES
                    + " bytes of random key material");
            }
            LOG.warnf("%s is too weak; ignoring it because allow-generated-secrets is enabled", property);
        } else if (!authConfig.allowGeneratedSecrets()) {
            LOG.errorf("%s is not configured; refusing to start", property);
            throw new ConfigurationException(property + " is required. Generate one with: openssl rand -base64 48");
        }
        return loadOrGenerateDevSecret(property, devFileName);
    }

    /**
     * Load a dev secret from the local directory, or generate and persist a new one.
     */
    private SecretKey loadOrGenerateDevSecret(String property, String fileName) {
        Path file = Path.of(authConfig.devSecretDir()).resolve(fileName);
        try {
            byte[] bytes;
            if (Files.exists(file)) {
                LOG.infof("Loading persisted dev secret from %s", file);
                bytes = Files.readAllBytes(file);
            } else {
                LOG.infof("Generating new dev secret (will be persisted to %s)", file);
                bytes = new byte[48];
                new SecureRandom().nextBytes(bytes);
                Files.createDirectories(file.getParent());
                Files.write(file, bytes);
            }
            if (!isStrong(bytes)) {
                throw new ConfigurationException("Persisted dev secret " + file + " is too weak; delete it to regenerate");
            }
            LOG.warnf("Using a generated dev secret for %s. Configure it explicitly for production.", property);
            return new SecretKeySpec(bytes, HMAC_ALGORITHM);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load or persist dev secret " + file, e);
        }
    }

    private static byte[] decode(String property, String value) {
        if (value.startsWith(BASE64_PREFIX)) {
            try {
                return Base64.getDecoder().decode(value.substring(BASE64_PREFIX.length()).trim());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(property + " is not valid base64", e);
            }
        }
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static void requireStrong(String label, byte[] bytes) {
        if (!isStrong(bytes)) {
            throw new ConfigurationException(label + " must contain at least " + MIN_SECRET_BYTES
                + " bytes of random key material");
        }
    }

    /**
     * Length check plus a crude guard against repeated-character secrets like "aaaa...".
     */
    static boolean isStrong(byte[] bytes) {
        if (bytes == null || bytes.length < MIN_SECRET_BYTES) {
            return false;
        }
        boolean[] seen = new boolean[256];
        int distinct = 0;
        for (byte b : bytes) {
            if (!seen[b & 0xFF]) {
                seen[b & 0xFF] = true;
                distinct++;
            }
        }
        return distinct >= MIN_DISTINCT_BYTES;
    }
}
