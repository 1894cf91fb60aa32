package tech.simplekanban.platform.shared;

/**
 * Entity types with their 3-character ID prefixes.
 *
 * IDs are stored WITH the prefix: "{prefix}_{tsid}" (e.g., "usr_0HZXEQ5Y8JY5Z").
 */
public enum EntityType {

    USER("usr"),
    API_KEY("key"),
    GROUP("grp"),
    GROUP_MEMBERSHIP("mbr"),
    BOARD("brd");

    private final String prefix;

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
