package tech.simplekanban.platform.user;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Argon2id hashing for account passwords (m=64 MiB, t=3, p=4, 32-byte digest, 16-byte salt).
 * Hashes are stored in PHC string form, so the parameters travel with each hash.
 */
@ApplicationScoped
public class PasswordService {

    private static final int MEMORY_COST = 65536;  // 64 MiB in KiB
    private static final int ITERATIONS = 3;
    private static final int PARALLELISM = 4;
    private static final int HASH_LENGTH = 32;
    private static final int SALT_LENGTH = 16;

    private static final int MIN_PASSWORD_LENGTH = 8;
    private static final int MAX_PASSWORD_LENGTH = 128;

    private final Argon2 argon2;

    public PasswordService() {
        this.argon2 = Argon2Factory.create(
            Argon2Factory.Argon2Types.ARGON2id,
            SALT_LENGTH,
            HASH_LENGTH
        );
    }

    /**
     * @return PHC-encoded hash, e.g. {@code $argon2id$v=19$m=65536,t=3,p=4$...}
     */
    public String hashPassword(String plainPassword) {
        if (plainPassword == null || plainPassword.isEmpty()) {
            throw new IllegalArgumentException("password is required");
        }
        return argon2.hash(ITERATIONS, MEMORY_COST, PARALLELISM, plainPassword.toCharArray());
    }

    /** A malformed or missing hash counts as a mismatch. */
    public boolean verifyPassword(String plainPassword, String passwordHash) {
        if (plainPassword == null || passwordHash == null) {
            return false;
        }

        try {
            return argon2.verify(passwordHash, plainPassword.toCharArray());
        } catch (RuntimeException e) {
            return false;
        }
    }

    /** True when the stored hash is not argon2id or used other cost parameters. */
    public boolean needsRehash(String passwordHash) {
        if (passwordHash == null || !passwordHash.startsWith("$argon2id$")) {
            return true;
        }

        // parts[3] holds "m=..,t=..,p=.."
        String[] parts = passwordHash.split("\\$");
        if (parts.length < 4) {
            return true;
        }

        String params = parts[3];
        return !(params.contains("m=" + MEMORY_COST)
            && params.contains("t=" + ITERATIONS)
            && params.contains("p=" + PARALLELISM));
    }

    /**
     * Accepts 8 to 128 characters with at least one letter and one digit.
     *
     * @throws IllegalArgumentException naming the first rule the password breaks
     */
    public void validatePasswordComplexity(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new IllegalArgumentException(
                "password needs at least " + MIN_PASSWORD_LENGTH + " characters"
            );
        }

        if (password.length() > MAX_PASSWORD_LENGTH) {
            throw new IllegalArgumentException(
                "password may not exceed " + MAX_PASSWORD_LENGTH + " characters"
            );
        }

        if (password.chars().noneMatch(Character::isLetter)) {
            throw new IllegalArgumentException("password needs a letter");
        }

        if (password.chars().noneMatch(Character::isDigit)) {
            throw new IllegalArgumentException("password needs a digit");
        }
    }

    public String validateAndHashPassword(String plainPassword) {
        validatePasswordComplexity(plainPassword);
        return hashPassword(plainPassword);
    }
}
