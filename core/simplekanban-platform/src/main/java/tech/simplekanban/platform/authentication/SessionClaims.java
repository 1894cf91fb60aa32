package tech.simplekanban.platform.authentication;

import java.time.Instant;

/**
 * Verified claims of a session token.
 */
public record SessionClaims(String userId, String sessionId, Instant issuedAt, Instant expiresAt) {
}
