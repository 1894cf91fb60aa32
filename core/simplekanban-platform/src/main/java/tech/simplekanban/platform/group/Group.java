package tech.simplekanban.platform.group;

import java.time.Instant;

/**
 * A named set of users that can own boards.
 */
public class Group {

    public String id;

    public String name;

    public String description;

    public Instant createdAt;

    public Instant updatedAt;

    public Group() {
    }
}
