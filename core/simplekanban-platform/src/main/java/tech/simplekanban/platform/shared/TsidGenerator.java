package tech.simplekanban.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Centralized TSID generation for all entities.
 *
 * Format: "{prefix}_{tsid}" (e.g., "usr_0HZXEQ5Y8JY5Z"), 17 characters in total.
 * Time-sortable, URL-safe and safe from JavaScript number precision issues.
 */
public class TsidGenerator {

    public static final String SEPARATOR = "_";

    /**
     * Generate a new typed ID for the given entity type.
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        return type.prefix() + SEPARATOR + TsidCreator.getTsid().toString();
    }

    /**
     * Generate a raw TSID without prefix (session ids, cache members).
     */
    public static String generateRaw() {
        return TsidCreator.getTsid().toString();
    }

    /**
     * Whether the given value looks like an ID of the given type.
     */
    public static boolean isTypedId(EntityType type, String value) {
        return value != null && value.startsWith(type.prefix() + SEPARATOR)
            && value.length() > type.prefix().length() + 1;
    }

    private TsidGenerator() {
        // Utility class
    }
}
