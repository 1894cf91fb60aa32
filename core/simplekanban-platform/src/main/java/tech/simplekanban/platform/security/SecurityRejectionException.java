package tech.simplekanban.platform.security;

import java.time.Duration;

/**
 * Ends request processing with a {@link SecurityRejection}. Rendered by
 * {@link SecurityRejectionExceptionMapper}.
 */
public class SecurityRejectionException extends RuntimeException {

    private final SecurityRejection rejection;
    private final Duration retryAfter;

    public SecurityRejectionException(SecurityRejection rejection) {
        this(rejection, rejection.defaultMessage(), null);
    }

    public SecurityRejectionException(SecurityRejection rejection, String message, Duration retryAfter) {
        super(message, null, false, false);
        this.rejection = rejection;
        this.retryAfter = retryAfter;
    }

    public static SecurityRejectionException unauthenticated() {
        return new SecurityRejectionException(SecurityRejection.UNAUTHENTICATED);
    }

    /**
     * Forbidden on a named resource. The message never says which rule denied access.
     */
    public static SecurityRejectionException forbidden(String resourceName) {
        return new SecurityRejectionException(SecurityRejection.FORBIDDEN,
            "Access denied to " + resourceName, null);
    }

    public static SecurityRejectionException rateLimited(Duration retryAfter) {
        return new SecurityRejectionException(SecurityRejection.RATE_LIMITED,
            SecurityRejection.RATE_LIMITED.defaultMessage(), retryAfter);
    }

    public static SecurityRejectionException csrfRejected() {
        return new SecurityRejectionException(SecurityRejection.CSRF_REJECTED);
    }

    public SecurityRejection rejection() {
        return rejection;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
