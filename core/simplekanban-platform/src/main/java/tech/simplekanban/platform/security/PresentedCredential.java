package tech.simplekanban.platform.security;

import tech.simplekanban.platform.identity.IdentityResolver;

import java.util.Optional;

/**
 * The raw credential a request carries, and where it was found.
 *
 * @param value  the opaque credential, never logged
 * @param origin the header or cookie it was read from
 */
public record PresentedCredential(String value, Origin origin) {

    private static final String BEARER_PREFIX = "Bearer ";
    public static final String API_KEY_HEADER = "X-API-Key";

    public enum Origin {
        AUTHORIZATION_HEADER,
        API_KEY_HEADER,
        SESSION_COOKIE
    }

    /**
     * Extract the credential. Lookup order: {@code Authorization: Bearer}, {@code X-API-Key},
     * then the session cookie. The first non-blank source wins.
     */
    public static Optional<PresentedCredential> extract(InboundRequest request, String sessionCookieName) {
        String authorization = request.header("Authorization");
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return Optional.of(new PresentedCredential(token, Origin.AUTHORIZATION_HEADER));
            }
        }

        String apiKey = request.header(API_KEY_HEADER);
        if (apiKey != null && !apiKey.isBlank()) {
            return Optional.of(new PresentedCredential(apiKey.trim(), Origin.API_KEY_HEADER));
        }

        String cookie = request.cookie(sessionCookieName);
        if (cookie != null && !cookie.isBlank()) {
            return Optional.of(new PresentedCredential(cookie, Origin.SESSION_COOKIE));
        }
        return Optional.empty();
    }

    public boolean isApiKey() {
        return IdentityResolver.isApiKey(value);
    }

    @Override
    public String toString() {
        return "PresentedCredential[origin=" + origin + "]";
    }
}
