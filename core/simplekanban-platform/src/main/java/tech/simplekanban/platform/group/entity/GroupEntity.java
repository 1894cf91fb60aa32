package tech.simplekanban.platform.group.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for the groups table.
 */
@Entity
@Table(name = "groups")
public class GroupEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "name", nullable = false, length = 100)
    public String name;

    @Column(name = "description", length = 500)
    public String description;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public GroupEntity() {
    }
}
