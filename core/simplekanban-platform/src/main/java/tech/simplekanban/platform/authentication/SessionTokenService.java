package tech.simplekanban.platform.authentication;

import io.smallrye.jwt.algorithm.SignatureAlgorithm;
import io.smallrye.jwt.build.Jwt;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.lang.JoseException;
import tech.simplekanban.platform.identity.AuthFailure;
import tech.simplekanban.platform.identity.CredentialRejectedException;
import tech.simplekanban.platform.identity.Principal;
import tech.simplekanban.platform.shared.TsidGenerator;
import tech.simplekanban.platform.user.User;
import tech.simplekanban.platform.user.UserRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Issues and validates stateless session tokens.
 *
 * <p>Tokens are HS256-signed JWTs carrying {@code sub} (user id), {@code jti} (session id),
 * {@code iat}, {@code exp} and {@code iss}. A token is valid while {@code iat <= now < exp}.
 * Validation checks the signature before anything touches the database.
 */
@ApplicationScoped
public class SessionTokenService {

    private static final Logger LOG = Logger.getLogger(SessionTokenService.class);

    private static final AlgorithmConstraints HS256_ONLY = new AlgorithmConstraints(
        AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256);

    @Inject
    AuthConfig authConfig;

    @Inject
    SecretKeyProvider secretKeyProvider;

    @Inject
    SessionRevocationService revocationService;

    @Inject
    UserRepository userRepository;

    @Inject
    Clock clock;

    /**
     * Issue a session token for a user. Pure function of the secret, the clock and the user id.
     */
    public SessionToken issue(User user) {
        // JWT NumericDates have second precision; truncate so exp is exactly iat + lifetime
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(authConfig.session().lifetime());
        String sessionId = TsidGenerator.generateRaw();

        String token = Jwt.issuer(authConfig.session().issuer())
            .subject(user.id)
            .claim("jti", sessionId)
            .issuedAt(issuedAt)
            .expiresAt(expiresAt)
            .jws()
            .algorithm(SignatureAlgorithm.HS256)
            .sign(secretKeyProvider.signingKey());

        LOG.debugf("Issued session %s for user %s, expires %s", sessionId, user.id, expiresAt);
        return new SessionToken(token, sessionId, issuedAt, expiresAt);
    }

    /**
     * Verify signature, issuer, validity window and revocation. Never touches the database.
     *
     * @throws CredentialRejectedException with MALFORMED, INVALID_SIGNATURE, EXPIRED or REVOKED
     */
    public SessionClaims verify(String token) {
        JsonWebSignature jws = new JsonWebSignature();
        jws.setAlgorithmConstraints(HS256_ONLY);
        try {
            jws.setCompactSerialization(token);
        } catch (JoseException e) {
            throw new CredentialRejectedException(AuthFailure.MALFORMED);
        }

        jws.setKey(secretKeyProvider.signingKey());
        boolean valid;
        try {
            valid = jws.verifySignature();
        } catch (JoseException e) {
            // Disallowed algorithm (e.g. "none") or unusable header
            LOG.debugf("Session token signature check failed: %s", e.getMessage());
            valid = false;
        }
        if (!valid) {
            throw new CredentialRejectedException(AuthFailure.INVALID_SIGNATURE);
        }

        SessionClaims claims = parseClaims(jws);

        Instant now = clock.instant();
        if (now.isBefore(claims.issuedAt()) || !now.isBefore(claims.expiresAt())) {
            throw new CredentialRejectedException(AuthFailure.EXPIRED);
        }
        if (revocationService.isRevoked(claims.sessionId())) {
            throw new CredentialRejectedException(AuthFailure.REVOKED);
        }
        return claims;
    }

    /**
     * Full validation: {@link #verify(String)} plus the checks that the user still exists, is
     * active and has not changed credentials since the token was issued.
     *
     * @throws CredentialRejectedException on any failure
     */
    public Principal validate(String token) {
        SessionClaims claims = verify(token);

        Optional<User> user = userRepository.findByIdOptional(claims.userId());
        if (user.isEmpty() || !user.get().active) {
            throw new CredentialRejectedException(AuthFailure.INACTIVE);
        }
        Instant credentialsChangedAt = user.get().credentialsChangedAt;
        if (credentialsChangedAt != null && claims.issuedAt().isBefore(credentialsChangedAt)) {
            throw new CredentialRejectedException(AuthFailure.REVOKED);
        }
        return Principal.session(claims.userId(), user.get().admin, claims.sessionId());
    }

    private SessionClaims parseClaims(JsonWebSignature jws) {
        try {
            JwtClaims claims = JwtClaims.parse(jws.getPayload());
            if (!authConfig.session().issuer().equals(claims.getIssuer())) {
                throw new CredentialRejectedException(AuthFailure.INVALID_SIGNATURE);
            }
            String subject = claims.getSubject();
            String sessionId = claims.getJwtId();
            NumericDate issuedAt = claims.getIssuedAt();
            NumericDate expiresAt = claims.getExpirationTime();
            if (subject == null || sessionId == null || issuedAt == null || expiresAt == null) {
                throw new CredentialRejectedException(AuthFailure.MALFORMED);
            }
            return new SessionClaims(subject, sessionId,
                Instant.ofEpochSecond(issuedAt.getValue()),
                Instant.ofEpochSecond(expiresAt.getValue()));
        } catch (InvalidJwtException | MalformedClaimException | JoseException e) {
            throw new CredentialRejectedException(AuthFailure.MALFORMED);
        }
    }
}
