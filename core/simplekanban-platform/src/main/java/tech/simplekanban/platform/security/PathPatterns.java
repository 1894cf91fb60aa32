package tech.simplekanban.platform.security;

import java.util.Collection;

/**
 * Matching for configured path lists. An entry ending in {@code /*} matches the prefix
 * and everything below it; any other entry must match exactly.
 */
public final class PathPatterns {

    private PathPatterns() {
    }

    public static boolean matchesAny(String path, Collection<String> patterns) {
        for (String pattern : patterns) {
            if (matches(path, pattern.trim())) {
                return true;
            }
        }
        return false;
    }

    public static boolean matches(String path, String pattern) {
        if (pattern.isEmpty()) {
            return false;
        }
        if (pattern.endsWith("/*")) {
            String prefix = pattern.substring(0, pattern.length() - 2);
            return path.equals(prefix) || path.startsWith(prefix + "/");
        }
        return path.equals(pattern);
    }
}
