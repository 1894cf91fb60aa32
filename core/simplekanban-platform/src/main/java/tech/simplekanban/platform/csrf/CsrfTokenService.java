package tech.simplekanban.platform.csrf;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.simplekanban.platform.authentication.SecretKeyProvider;

import javax.crypto.Mac;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * Derives the CSRF token bound to a session.
 *
 * <p>The token is an HMAC of the session id under the signing key, so it needs no storage,
 * cannot be forged without the key, and dies with the session.
 */
@ApplicationScoped
public class CsrfTokenService {

    private static final String DOMAIN_SEPARATOR = "csrf:";

    @Inject
    SecretKeyProvider secretKeyProvider;

    public CsrfTokenService() {
    }

    public CsrfTokenService(SecretKeyProvider secretKeyProvider) {
        this.secretKeyProvider = secretKeyProvider;
    }

    public String tokenFor(String sessionId) {
        try {
            Mac mac = Mac.getInstance(secretKeyProvider.signingKey().getAlgorithm());
            mac.init(secretKeyProvider.signingKey());
            byte[] digest = mac.doFinal((DOMAIN_SEPARATOR + sessionId).getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    /**
     * Constant-time comparison of a presented token against the one expected for the session.
     */
    public boolean matches(String sessionId, String presented) {
        if (presented == null || presented.isEmpty()) {
            return false;
        }
        byte[] expected = tokenFor(sessionId).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, presented.getBytes(StandardCharsets.UTF_8));
    }
}
