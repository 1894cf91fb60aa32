package tech.simplekanban.platform.apikey;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.simplekanban.platform.authentication.SecretKeyProvider;

import javax.crypto.Mac;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Keyed hashing of API key secrets (HMAC-SHA256, hex encoded).
 *
 * <p>The hash is deterministic so a key can be found through the indexed
 * {@link #lookupPrefix(String)} of its hash instead of scanning every row.
 */
@ApplicationScoped
public class ApiKeyHasher {

    static final int LOOKUP_PREFIX_LENGTH = 16;
    private static final String ALGORITHM = "HmacSHA256";
    private static final HexFormat HEX = HexFormat.of();

    @Inject
    SecretKeyProvider secretKeyProvider;

    public ApiKeyHasher() {
    }

    public ApiKeyHasher(SecretKeyProvider secretKeyProvider) {
        this.secretKeyProvider = secretKeyProvider;
    }

    public String hash(String plaintext) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(secretKeyProvider.apiKeyHashKey());
            return HEX.formatHex(mac.doFinal(plaintext.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    public static String lookupPrefix(String hash) {
        return hash.substring(0, LOOKUP_PREFIX_LENGTH);
    }

    /**
     * Constant-time comparison of two hex hashes.
     */
    public static boolean matches(String presentedHash, String storedHash) {
        if (presentedHash == null || storedHash == null) {
            return false;
        }
        return MessageDigest.isEqual(
            presentedHash.getBytes(StandardCharsets.US_ASCII),
            storedHash.getBytes(StandardCharsets.US_ASCII));
    }
}
