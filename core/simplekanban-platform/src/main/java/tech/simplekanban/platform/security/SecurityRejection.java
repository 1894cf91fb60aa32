package tech.simplekanban.platform.security;

/**
 * Client-facing categories of request rejection, with their HTTP status and error code.
 */
public enum SecurityRejection {

    UNAUTHENTICATED(401, "UNAUTHENTICATED", "Invalid credentials"),
    FORBIDDEN(403, "FORBIDDEN", "Access denied"),
    RATE_LIMITED(429, "RATE_LIMITED", "Too many requests"),
    CSRF_REJECTED(403, "CSRF_REJECTED", "Missing or invalid CSRF token");

    private final int status;
    private final String code;
    private final String defaultMessage;

    SecurityRejection(int status, String code, String defaultMessage) {
        this.status = status;
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public int status() {
        return status;
    }

    public String code() {
        return code;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
