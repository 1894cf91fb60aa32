package tech.simplekanban.platform.security;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Transport-neutral view of an HTTP request, as far as the security pipeline needs it.
 *
 * <p>Header names are case-insensitive; only the first value of each header is kept.
 */
public record InboundRequest(
    String method,
    String path,
    Map<String, String> headers,
    Map<String, String> cookies,
    String remoteAddress
) {

    private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS", "TRACE");

    public InboundRequest {
        method = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
        path = path == null || path.isEmpty() ? "/" : path;
        Map<String, String> normalized = new HashMap<>();
        if (headers != null) {
            headers.forEach((name, value) -> normalized.putIfAbsent(name.toLowerCase(Locale.ROOT), value));
        }
        headers = Map.copyOf(normalized);
        cookies = cookies == null ? Map.of() : Map.copyOf(cookies);
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    public String cookie(String name) {
        return cookies.get(name);
    }

    /**
     * True for methods that must not change state (GET, HEAD, OPTIONS, TRACE).
     */
    public boolean isSafeMethod() {
        return SAFE_METHODS.contains(method);
    }
}
