package tech.simplekanban.platform.authentication;

import java.time.Instant;

/**
 * A freshly signed session token.
 */
public record SessionToken(String token, String sessionId, Instant issuedAt, Instant expiresAt) {

    public SessionClaims claims(String userId) {
        return new SessionClaims(userId, sessionId, issuedAt, expiresAt);
    }
}
