package tech.simplekanban.platform.apikey;

import java.util.Arrays;
import java.util.Optional;

/**
 * Named capability caps attached to an API key at issuance.
 */
public enum ApiKeyScope {
    READ("read"),
    WRITE("write"),
    ADMIN("admin"),
    DOCS("docs");

    private final String value;

    ApiKeyScope(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ApiKeyScope> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
            .filter(scope -> scope.value.equals(normalized))
            .findFirst();
    }
}
