package tech.simplekanban.platform.group.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import tech.simplekanban.platform.group.GroupRole;

import java.time.Instant;

/**
 * JPA entity for the group_memberships table.
 */
@Entity
@Table(name = "group_memberships",
    uniqueConstraints = @UniqueConstraint(name = "uq_group_memberships_group_user", columnNames = {"group_id", "user_id"}),
    indexes = @Index(name = "idx_group_memberships_user_id", columnList = "user_id"))
public class GroupMembershipEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "group_id", nullable = false, length = 17)
    public String groupId;

    @Column(name = "user_id", nullable = false, length = 17)
    public String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    public GroupRole role;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public GroupMembershipEntity() {
    }
}
