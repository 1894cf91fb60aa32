package tech.simplekanban.platform.authorization;

import java.util.Objects;

/**
 * Identifies the resource an action targets.
 */
public record ResourceRef(ResourceType type, String id) {

    public static final ResourceRef SYSTEM = new ResourceRef(ResourceType.SYSTEM, "system");

    public ResourceRef {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
    }

    public static ResourceRef board(String id) {
        return new ResourceRef(ResourceType.BOARD, id);
    }

    public static ResourceRef group(String id) {
        return new ResourceRef(ResourceType.GROUP, id);
    }

    public static ResourceRef apiKey(String id) {
        return new ResourceRef(ResourceType.API_KEY, id);
    }

    public static ResourceRef user(String id) {
        return new ResourceRef(ResourceType.USER, id);
    }

    /**
     * Name safe to show in a forbidden response.
     */
    public String displayName() {
        return type.name().toLowerCase().replace('_', ' ') + " " + id;
    }
}
