package tech.simplekanban.platform.board;

import java.time.Instant;

/**
 * The ownership view of a board. Column and task data belong to the kanban CRUD layer.
 *
 * <p>Access is rooted in exactly one of {@link #ownerId} (personal board) or
 * {@link #groupId} (group board). A board whose group was deleted has neither and is
 * reachable by administrators only.
 */
public class Board {

    public String id;

    public String name;

    public String description;

    /** Personal owner; null for group boards. */
    public String ownerId;

    /** Owning group; null for personal boards. */
    public String groupId;

    /** Who created the board. Informational only, never used for access decisions. */
    public String createdBy;

    public Instant createdAt;

    public Instant updatedAt;

    public Board() {
    }

    public boolean isPersonal() {
        return ownerId != null && groupId == null;
    }

    public boolean isGroupOwned() {
        return groupId != null;
    }
}
