package tech.simplekanban.platform.identity;

/**
 * Why a credential was not accepted. Kept for logs and tests only: every value is
 * reported to clients as the same "Invalid credentials" 401.
 */
public enum AuthFailure {
    MISSING_CREDENTIAL,
    MALFORMED,
    INVALID_SIGNATURE,
    KEY_NOT_FOUND,
    EXPIRED,
    /** Session id was logged out before the token expired. */
    REVOKED,
    /** The API key is deactivated, or the session's user is inactive or gone. */
    INACTIVE,
    /** The API key's owning user is inactive or gone. */
    OWNER_INACTIVE
}
