package tech.simplekanban.platform.testing;

import tech.simplekanban.platform.authentication.SecretKeyProvider;
import tech.simplekanban.platform.user.User;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Shared test data.
 */
public final class Fixtures {

    public static final byte[] SIGNING_SECRET =
        "test-signing-secret-0123456789-abcdefghijklmnop".getBytes(StandardCharsets.UTF_8);
    public static final byte[] API_KEY_HASH_SECRET =
        "test-api-key-hash-secret-9876543210-zyxwvutsrq".getBytes(StandardCharsets.UTF_8);

    private Fixtures() {
    }

    public static SecretKeyProvider secretKeyProvider() {
        return SecretKeyProvider.of(SIGNING_SECRET, API_KEY_HASH_SECRET);
    }

    public static User user(String id, boolean active, boolean admin) {
        User user = new User();
        user.id = id;
        user.username = "user-" + id;
        user.email = id + "@example.com";
        user.passwordHash = "$argon2id$stub";
        user.active = active;
        user.admin = admin;
        user.createdAt = Instant.parse("2024-01-01T00:00:00Z");
        user.updatedAt = user.createdAt;
        return user;
    }
}
