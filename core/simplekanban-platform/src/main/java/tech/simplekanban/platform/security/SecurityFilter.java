package tech.simplekanban.platform.security;

import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.net.SocketAddress;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.ext.Provider;
import tech.simplekanban.platform.ratelimit.RateLimitDecision;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * JAX-RS filter that runs every API request through the {@link RequestSecurityPipeline}.
 *
 * <p>Public endpoints (login, registration) only pass the CSRF and rate-limit stages.
 * Everything else must also authenticate; the principal is then available from
 * {@link SecurityContextHolder}. Rejections abort the request with the mapped error response.
 *
 * <p>Allowed responses carry {@code X-RateLimit-Limit} and {@code X-RateLimit-Remaining}.
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class SecurityFilter implements ContainerRequestFilter, ContainerResponseFilter {

    static final List<String> PUBLIC_PATHS = List.of(
        "/api/auth/login",
        "/api/auth/register",
        "/q/*",
        "/static/*"
    );

    private static final String RATE_LIMIT_PROPERTY = SecurityFilter.class.getName() + ".rateLimit";

    @Inject
    RequestSecurityPipeline pipeline;

    @Inject
    SecurityContextHolder securityContextHolder;

    @Context
    HttpServerRequest httpRequest;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        InboundRequest request = toInboundRequest(requestContext);
        try {
            RateLimitDecision decision;
            if (PathPatterns.matchesAny(request.path(), PUBLIC_PATHS)) {
                decision = pipeline.admit(request);
            } else {
                RequestSecurityPipeline.SecuredRequest secured = pipeline.authenticate(request);
                securityContextHolder.setPrincipal(secured.principal());
                decision = secured.rateLimit();
            }
            if (decision != null) {
                requestContext.setProperty(RATE_LIMIT_PROPERTY, decision);
            }
        } catch (SecurityRejectionException e) {
            requestContext.abortWith(
                SecurityRejectionExceptionMapper.toResponse(e.rejection(), e.getMessage(), e.retryAfter()));
        }
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        Object property = requestContext.getProperty(RATE_LIMIT_PROPERTY);
        if (property instanceof RateLimitDecision decision) {
            responseContext.getHeaders().putSingle("X-RateLimit-Limit", decision.limit());
            responseContext.getHeaders().putSingle("X-RateLimit-Remaining", decision.remaining());
        }
    }

    private InboundRequest toInboundRequest(ContainerRequestContext requestContext) {
        String path = requestContext.getUriInfo().getPath();
        if (!path.startsWith("/")) {
            path = "/" + path;
        }

        Map<String, String> headers = new HashMap<>();
        requestContext.getHeaders().forEach((name, values) -> {
            if (values != null && !values.isEmpty()) {
                headers.put(name, values.get(0));
            }
        });

        Map<String, String> cookies = new HashMap<>();
        for (Map.Entry<String, Cookie> entry : requestContext.getCookies().entrySet()) {
            cookies.put(entry.getKey(), entry.getValue().getValue());
        }

        return new InboundRequest(requestContext.getMethod(), path, headers, cookies, remoteAddress());
    }

    private String remoteAddress() {
        if (httpRequest == null) {
            return null;
        }
        SocketAddress address = httpRequest.remoteAddress();
        return address != null ? address.hostAddress() : null;
    }
}
