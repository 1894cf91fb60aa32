package tech.simplekanban.platform.security;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.ext.Provider;
import tech.simplekanban.platform.authentication.AuthConfig;

/**
 * Adds browser hardening headers to every API response.
 *
 * <p>HSTS is only sent when session cookies are marked secure, i.e. when the application
 * is served over HTTPS. Authentication responses are never cached.
 */
@Provider
@Priority(Priorities.HEADER_DECORATOR)
public class SecurityHeadersFilter implements ContainerResponseFilter {

    static final String CONTENT_SECURITY_POLICY = "default-src 'self'; "
        + "script-src 'self' 'unsafe-inline'; "
        + "style-src 'self' 'unsafe-inline'; "
        + "img-src 'self' data: https:; "
        + "connect-src 'self'; "
        + "frame-ancestors 'none'; "
        + "base-uri 'self'; "
        + "form-action 'self'";

    @Inject
    AuthConfig authConfig;

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        MultivaluedMap<String, Object> headers = responseContext.getHeaders();
        headers.putSingle("X-Content-Type-Options", "nosniff");
        headers.putSingle("X-Frame-Options", "DENY");
        headers.putSingle("Referrer-Policy", "strict-origin-when-cross-origin");
        headers.putSingle("Permissions-Policy", "geolocation=(), microphone=(), camera=()");
        headers.putSingle("Content-Security-Policy", CONTENT_SECURITY_POLICY);

        if (authConfig.session().secureCookie()) {
            headers.putSingle("Strict-Transport-Security", "max-age=31536000; includeSubDomains");
        }

        String path = requestContext.getUriInfo().getPath();
        if (path.startsWith("/api/auth") || path.startsWith("api/auth")) {
            headers.putSingle(HttpHeaders.CACHE_CONTROL, "no-store");
            headers.putSingle("Pragma", "no-cache");
        }
    }
}
