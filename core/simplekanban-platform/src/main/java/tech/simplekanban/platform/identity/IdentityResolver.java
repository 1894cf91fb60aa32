package tech.simplekanban.platform.identity;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.simplekanban.platform.apikey.ApiKeyService;
import tech.simplekanban.platform.apikey.ApiKeyUsageRecorder;
import tech.simplekanban.platform.authentication.SessionTokenService;

/**
 * Single entry point turning a raw credential into a {@link Principal}.
 *
 * <p>API keys start with {@code sk_}; anything else is treated as a session token.
 * The two formats never overlap, so each credential is parsed exactly once.
 */
@ApplicationScoped
public class IdentityResolver {

    private static final Logger LOG = Logger.getLogger(IdentityResolver.class);

    @Inject
    SessionTokenService sessionTokenService;

    @Inject
    ApiKeyService apiKeyService;

    @Inject
    ApiKeyUsageRecorder usageRecorder;

    public Resolution resolve(String rawCredential) {
        if (rawCredential == null || rawCredential.isBlank()) {
            return Resolution.failed(AuthFailure.MISSING_CREDENTIAL);
        }

        try {
            if (isApiKey(rawCredential)) {
                ApiKeyService.ValidatedApiKey validated = apiKeyService.validate(rawCredential);
                usageRecorder.recordUse(validated.apiKey().id);
                return Resolution.resolved(validated.principal());
            }
            return Resolution.resolved(sessionTokenService.validate(rawCredential));
        } catch (CredentialRejectedException e) {
            AuthFailure failure = e.failure() == AuthFailure.OWNER_INACTIVE ? AuthFailure.INACTIVE : e.failure();
            LOG.debugf("Credential rejected: %s", failure);
            return Resolution.failed(failure);
        }
    }

    public static boolean isApiKey(String rawCredential) {
        return rawCredential.startsWith(ApiKeyService.KEY_PREFIX);
    }
}
