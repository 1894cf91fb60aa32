package tech.simplekanban.platform.user.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for the users table.
 */
@Entity
@Table(name = "users")
public class UserEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "username", nullable = false, unique = true, length = 50)
    public String username;

    @Column(name = "email", nullable = false, unique = true)
    public String email;

    @Column(name = "password_hash")
    public String passwordHash;

    @Column(name = "full_name")
    public String fullName;

    @Column(name = "active", nullable = false)
    public boolean active;

    @Column(name = "admin", nullable = false)
    public boolean admin;

    @Column(name = "credentials_changed_at")
    public Instant credentialsChangedAt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public UserEntity() {
    }
}
