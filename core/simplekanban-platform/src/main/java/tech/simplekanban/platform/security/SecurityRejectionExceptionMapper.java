package tech.simplekanban.platform.security;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import tech.simplekanban.platform.common.api.ApiResponses.ErrorResponse;

import java.time.Duration;

/**
 * Renders security rejections as JSON error bodies with the matching status code.
 *
 * <p>Response format:
 * <pre>
 * {
 *   "code": "CSRF_REJECTED",
 *   "message": "Missing or invalid CSRF token",
 *   "details": {}
 * }
 * </pre>
 */
@Provider
public class SecurityRejectionExceptionMapper implements ExceptionMapper<SecurityRejectionException> {

    @Override
    public Response toResponse(SecurityRejectionException exception) {
        return toResponse(exception.rejection(), exception.getMessage(), exception.retryAfter());
    }

    public static Response toResponse(SecurityRejection rejection, String message, Duration retryAfter) {
        // Unauthenticated never explains itself
        String body = rejection == SecurityRejection.UNAUTHENTICATED ? rejection.defaultMessage() : message;
        Response.ResponseBuilder builder = Response.status(rejection.status())
            .entity(new ErrorResponse(rejection.code(), body))
            .type(MediaType.APPLICATION_JSON);
        if (rejection == SecurityRejection.RATE_LIMITED && retryAfter != null) {
            builder.header("Retry-After", retryAfterSeconds(retryAfter));
        }
        if (rejection == SecurityRejection.UNAUTHENTICATED) {
            builder.header("WWW-Authenticate", "Bearer");
        }
        return builder.build();
    }

    /**
     * Whole seconds, rounded up, at least one.
     */
    static long retryAfterSeconds(Duration retryAfter) {
        long millis = Math.max(0, retryAfter.toMillis());
        return Math.max(1, (millis + 999) / 1000);
    }
}
