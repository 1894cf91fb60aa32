package tech.simplekanban.platform.user;

import java.time.Instant;

/**
 * A user account. Deactivated rather than deleted so ownership history stays intact.
 */
public class User {

    public String id;

    public String username;

    public String email;

    /** Argon2id hash in PHC format; null for accounts created by an external identity provider. */
    public String passwordHash;

    public String fullName;

    public boolean active = true;

    public boolean admin = false;

    /** Session tokens issued before this instant are rejected; set when the password changes. */
    public Instant credentialsChangedAt;

    public Instant createdAt;

    public Instant updatedAt;

    public User() {
    }
}
