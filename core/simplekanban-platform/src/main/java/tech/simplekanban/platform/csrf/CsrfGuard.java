package tech.simplekanban.platform.csrf;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.simplekanban.platform.authentication.AuthConfig;
import tech.simplekanban.platform.authentication.SessionClaims;
import tech.simplekanban.platform.security.InboundRequest;
import tech.simplekanban.platform.security.PathPatterns;
import tech.simplekanban.platform.security.PresentedCredential;
import tech.simplekanban.platform.security.SecurityRejectionException;

/**
 * Double-submit CSRF check for state-changing requests made with a browser session.
 *
 * <p>Requests pass untouched when they use a safe method, hit an exempt path, carry no
 * credential or carry an API key. A session token that does not verify is left for the
 * identity stage to reject. Otherwise the CSRF header must hold the token bound to the
 * session.
 */
@ApplicationScoped
public class CsrfGuard {

    private static final Logger LOG = Logger.getLogger(CsrfGuard.class);

    @Inject
    AuthConfig authConfig;

    @Inject
    CsrfTokenService csrfTokenService;

    public CsrfGuard() {
    }

    public CsrfGuard(AuthConfig authConfig, CsrfTokenService csrfTokenService) {
        this.authConfig = authConfig;
        this.csrfTokenService = csrfTokenService;
    }

    /**
     * @param credential the credential found on the request, or null
     * @param session    the verified claims of a session credential, or null
     * @throws SecurityRejectionException with {@code CSRF_REJECTED} on a missing or wrong token
     */
    public void check(InboundRequest request, PresentedCredential credential, SessionClaims session) {
        if (!requiresToken(request, credential) || session == null) {
            return;
        }

        String presented = request.header(authConfig.csrf().headerName());
        if (!csrfTokenService.matches(session.sessionId(), presented)) {
            LOG.infof("CSRF check failed for %s %s (token %s)", request.method(), request.path(),
                presented == null ? "missing" : "mismatched");
            throw SecurityRejectionException.csrfRejected();
        }
    }

    boolean requiresToken(InboundRequest request, PresentedCredential credential) {
        if (!authConfig.csrf().enabled() || request.isSafeMethod()) {
            return false;
        }
        if (PathPatterns.matchesAny(request.path(), authConfig.csrf().exemptPaths())) {
            return false;
        }
        return credential != null && !credential.isApiKey();
    }
}
