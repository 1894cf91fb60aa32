package tech.simplekanban.platform.security;

import jakarta.enterprise.context.RequestScoped;
import tech.simplekanban.platform.identity.Principal;

import java.util.Optional;

/**
 * Request-scoped holder of the authenticated principal, populated by {@link SecurityFilter}.
 */
@RequestScoped
public class SecurityContextHolder {

    private Principal principal;

    void setPrincipal(Principal principal) {
        this.principal = principal;
    }

    public Optional<Principal> principal() {
        return Optional.ofNullable(principal);
    }

    /**
     * The principal of an authenticated endpoint.
     *
     * @throws SecurityRejectionException when the request is not authenticated
     */
    public Principal requirePrincipal() {
        if (principal == null) {
            throw SecurityRejectionException.unauthenticated();
        }
        return principal;
    }
}
