package tech.simplekanban.platform.group;

import java.time.Instant;

/**
 * A user's membership in a group. Unique per (group, user).
 */
public class GroupMembership {

    public String id;

    public String groupId;

    public String userId;

    public GroupRole role;

    public Instant createdAt;

    public GroupMembership() {
    }
}
