package tech.simplekanban.platform.identity;

import java.util.List;
import java.util.Objects;

/**
 * The authenticated identity of a request, whichever credential type was presented.
 *
 * <p>Handlers and the authorization engine consume only this type.
 *
 * @param userId    the authenticated user
 * @param source    credential discriminant
 * @param admin     the user's administrator flag at resolution time
 * @param scopes    API key scopes exactly as stored at issuance (empty for sessions)
 * @param apiKeyId  the key used, for API key principals
 * @param sessionId the token id, for session principals
 */
public record Principal(
    String userId,
    CredentialSource source,
    boolean admin,
    List<String> scopes,
    String apiKeyId,
    String sessionId
) {

    public Principal {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(source, "source");
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public static Principal session(String userId, boolean admin, String sessionId) {
        return new Principal(userId, CredentialSource.SESSION, admin, List.of(), null, sessionId);
    }

    public static Principal apiKey(String userId, boolean admin, List<String> scopes, String apiKeyId) {
        return new Principal(userId, CredentialSource.API_KEY, admin, scopes, apiKeyId, null);
    }

    public boolean isApiKey() {
        return source == CredentialSource.API_KEY;
    }
}
