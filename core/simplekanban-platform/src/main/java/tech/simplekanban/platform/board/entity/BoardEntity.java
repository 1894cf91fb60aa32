package tech.simplekanban.platform.board.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for the ownership columns of the boards table.
 */
@Entity
@Table(name = "boards", indexes = {
    @Index(name = "idx_boards_owner_id", columnList = "owner_id"),
    @Index(name = "idx_boards_group_id", columnList = "group_id")
})
public class BoardEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "name", nullable = false)
    public String name;

    @Column(name = "description")
    public String description;

    @Column(name = "owner_id", length = 17)
    public String ownerId;

    @Column(name = "group_id", length = 17)
    public String groupId;

    @Column(name = "created_by", length = 17)
    public String createdBy;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public BoardEntity() {
    }
}
