package tech.simplekanban.platform.group;

import java.util.Arrays;
import java.util.Optional;

/**
 * A member's role within a group.
 */
public enum GroupRole {
    OWNER("owner"),
    ADMIN("admin"),
    MEMBER("member");

    private final String value;

    GroupRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<GroupRole> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
            .filter(role -> role.value.equals(normalized))
            .findFirst();
    }
}
