package tech.simplekanban.platform.security;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.simplekanban.platform.authentication.AuthConfig;
import tech.simplekanban.platform.authentication.SessionClaims;
import tech.simplekanban.platform.authentication.SessionTokenService;
import tech.simplekanban.platform.csrf.CsrfGuard;
import tech.simplekanban.platform.identity.CredentialRejectedException;
import tech.simplekanban.platform.identity.IdentityResolver;
import tech.simplekanban.platform.identity.Principal;
import tech.simplekanban.platform.identity.Resolution;
import tech.simplekanban.platform.ratelimit.ClientAddressResolver;
import tech.simplekanban.platform.ratelimit.RateLimitConfig;
import tech.simplekanban.platform.ratelimit.RateLimitDecision;
import tech.simplekanban.platform.ratelimit.RateLimiter;

import java.util.Optional;

/**
 * Runs the request security stages in their fixed order: CSRF, then rate limiting, then
 * identity resolution. Each stage may end the request with a {@link SecurityRejectionException}.
 *
 * <p>CSRF runs first because it is the cheapest check and should reject forged requests
 * before they consume rate-limit budget.
 */
@ApplicationScoped
public class RequestSecurityPipeline {

    private static final Logger LOG = Logger.getLogger(RequestSecurityPipeline.class);

    @Inject
    AuthConfig authConfig;

    @Inject
    RateLimitConfig rateLimitConfig;

    @Inject
    CsrfGuard csrfGuard;

    @Inject
    RateLimiter rateLimiter;

    @Inject
    ClientAddressResolver clientAddressResolver;

    @Inject
    SessionTokenService sessionTokenService;

    @Inject
    IdentityResolver identityResolver;

    /**
     * Full chain for protected endpoints.
     *
     * @return the principal plus the rate-limit decision (null when the path is exempt)
     * @throws SecurityRejectionException on CSRF failure, throttling or a missing/invalid credential
     */
    public SecuredRequest authenticate(InboundRequest request) {
        Optional<PresentedCredential> credential = extractCredential(request);
        RateLimitDecision decision = guard(request, credential);

        if (credential.isEmpty()) {
            throw SecurityRejectionException.unauthenticated();
        }

        Resolution resolution = identityResolver.resolve(credential.get().value());
        if (resolution instanceof Resolution.Failed failed) {
            LOG.debugf("Authentication failed for %s %s: %s", request.method(), request.path(), failed.failure());
            throw SecurityRejectionException.unauthenticated();
        }
        Principal principal = ((Resolution.Resolved) resolution).principal();
        return new SecuredRequest(principal, decision);
    }

    /**
     * CSRF and rate limiting only, for endpoints that do not require a credential.
     */
    public RateLimitDecision admit(InboundRequest request) {
        return guard(request, extractCredential(request));
    }

    private Optional<PresentedCredential> extractCredential(InboundRequest request) {
        return PresentedCredential.extract(request, authConfig.session().cookieName());
    }

    private RateLimitDecision guard(InboundRequest request, Optional<PresentedCredential> credential) {
        SessionClaims session = credential
            .filter(c -> !c.isApiKey())
            .flatMap(c -> verifySession(c.value()))
            .orElse(null);

        csrfGuard.check(request, credential.orElse(null), session);

        if (!rateLimitConfig.enabled() || PathPatterns.matchesAny(request.path(), rateLimitConfig.exemptPaths())) {
            return null;
        }
        RateLimitDecision decision = rateLimiter.check(clientKey(request, session));
        if (!decision.allowed()) {
            throw SecurityRejectionException.rateLimited(decision.retryAfter());
        }
        return decision;
    }

    /**
     * Rate-limit bucket: the user of a verified session, otherwise the client address.
     * API keys are not verified until the identity stage, so they count against the address.
     */
    String clientKey(InboundRequest request, SessionClaims session) {
        if (session != null) {
            return "user:" + session.userId();
        }
        return "ip:" + clientAddressResolver.resolve(request.remoteAddress(), request.header("X-Forwarded-For"));
    }

    private Optional<SessionClaims> verifySession(String token) {
        try {
            return Optional.of(sessionTokenService.verify(token));
        } catch (CredentialRejectedException e) {
            return Optional.empty();
        }
    }

    /**
     * Outcome of a successful pass through the pipeline.
     */
    public record SecuredRequest(Principal principal, RateLimitDecision rateLimit) {
    }
}
