package tech.simplekanban.platform.user;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.simplekanban.platform.common.Result;
import tech.simplekanban.platform.common.errors.UseCaseError;
import tech.simplekanban.platform.shared.EntityType;
import tech.simplekanban.platform.shared.TsidGenerator;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Credential-store operations on user accounts: registration, password login, profile and
 * password changes, activation and the administrator flag.
 */
@ApplicationScoped
public class UserService {

    private static final Logger LOG = Logger.getLogger(UserService.class);
    private static final Pattern USERNAME_PATTERN = Pattern.compile("^[A-Za-z0-9_.-]{3,50}$");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    @Inject
    UserRepository userRepository;

    @Inject
    PasswordService passwordService;

    @Inject
    Clock clock;

    /** Verified against when no account matches, so unknown logins cost the same as wrong passwords. */
    private volatile String dummyHash;

    /**
     * Register a new active user. The very first account becomes the administrator;
     * every later one is a regular user.
     */
    @Transactional
    public Result<User> register(String username, String email, String password, String fullName) {
        if (username == null || !USERNAME_PATTERN.matcher(username).matches()) {
            return Result.failure(new UseCaseError.ValidationError("INVALID_USERNAME",
                "Username must be 3-50 characters of letters, digits, '.', '_' or '-'"));
        }
        if (email == null || !EMAIL_PATTERN.matcher(email).matches()) {
            return Result.failure(new UseCaseError.ValidationError("INVALID_EMAIL", "Email address is not valid"));
        }

        String passwordHash;
        try {
            passwordHash = passwordService.validateAndHashPassword(password);
        } catch (IllegalArgumentException e) {
            return Result.failure(new UseCaseError.ValidationError("WEAK_PASSWORD", e.getMessage()));
        }

        if (userRepository.existsByUsername(username)) {
            return Result.failure(new UseCaseError.BusinessRuleViolation("USERNAME_TAKEN",
                "Username already registered"));
        }
        if (userRepository.existsByEmail(email)) {
            return Result.failure(new UseCaseError.BusinessRuleViolation("EMAIL_TAKEN",
                "Email already registered"));
        }

        Instant now = clock.instant();
        User user = new User();
        user.id = TsidGenerator.generate(EntityType.USER);
        user.username = username;
        user.email = email.toLowerCase();
        user.passwordHash = passwordHash;
        user.fullName = fullName;
        user.active = true;
        user.admin = isFirstUser();
        user.createdAt = now;
        user.updatedAt = now;

        userRepository.persist(user);
        LOG.infof("Registered user %s%s", user.id, user.admin ? " as the initial administrator" : "");
        return Result.success(user);
    }

    /**
     * Check a username-or-email and password pair.
     *
     * @return the user when the password matches and the account is active; empty otherwise,
     *         with no indication of which check failed
     */
    @Transactional
    public Optional<User> authenticate(String login, String password) {
        if (login == null || login.isBlank() || password == null) {
            return Optional.empty();
        }

        Optional<User> found = login.contains("@")
            ? userRepository.findByEmail(login)
            : userRepository.findByUsername(login);

        if (found.isEmpty() || found.get().passwordHash == null) {
            passwordService.verifyPassword(password, dummyHash());
            LOG.debug("Login failed: no matching account");
            return Optional.empty();
        }

        User user = found.get();
        if (!passwordService.verifyPassword(password, user.passwordHash)) {
            LOG.debugf("Login failed: wrong password for %s", user.id);
            return Optional.empty();
        }
        if (!user.active) {
            LOG.debugf("Login failed: user %s is inactive", user.id);
            return Optional.empty();
        }

        if (passwordService.needsRehash(user.passwordHash)) {
            user.passwordHash = passwordService.hashPassword(password);
            user.updatedAt = clock.instant();
            userRepository.update(user);
            LOG.infof("Upgraded password hash for user %s", user.id);
        }
        return Optional.of(user);
    }

    /**
     * Replace the password after checking the current one. Session tokens issued before the
     * change stop validating; the caller is expected to hand out a fresh session.
     */
    @Transactional
    public Result<User> changePassword(String userId, String currentPassword, String newPassword) {
        Optional<User> found = userRepository.findByIdOptional(userId);
        if (found.isEmpty()) {
            return Result.failure(userNotFound(userId));
        }

        User user = found.get();
        if (user.passwordHash == null || !passwordService.verifyPassword(currentPassword, user.passwordHash)) {
            LOG.infof("Password change rejected for user %s: current password did not match", userId);
            return Result.failure(new UseCaseError.ValidationError("INVALID_CURRENT_PASSWORD",
                "Current password is incorrect"));
        }

        String newHash;
        try {
            newHash = passwordService.validateAndHashPassword(newPassword);
        } catch (IllegalArgumentException e) {
            return Result.failure(new UseCaseError.ValidationError("WEAK_PASSWORD", e.getMessage()));
        }

        // Token iat has second precision
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        user.passwordHash = newHash;
        user.credentialsChangedAt = now;
        user.updatedAt = now;
        userRepository.update(user);
        LOG.infof("Password changed for user %s, earlier sessions revoked", userId);
        return Result.success(user);
    }

    /**
     * Change email and/or full name. Null leaves a field unchanged.
     */
    @Transactional
    public Result<User> updateProfile(String userId, String email, String fullName) {
        Optional<User> found = userRepository.findByIdOptional(userId);
        if (found.isEmpty()) {
            return Result.failure(userNotFound(userId));
        }

        User user = found.get();
        if (email != null && !email.equalsIgnoreCase(user.email)) {
            if (!EMAIL_PATTERN.matcher(email).matches()) {
                return Result.failure(new UseCaseError.ValidationError("INVALID_EMAIL", "Email address is not valid"));
            }
            if (userRepository.existsByEmail(email)) {
                return Result.failure(new UseCaseError.BusinessRuleViolation("EMAIL_TAKEN",
                    "Email already registered"));
            }
            user.email = email.toLowerCase();
        }
        if (fullName != null) {
            user.fullName = fullName.isBlank() ? null : fullName.trim();
        }

        user.updatedAt = clock.instant();
        userRepository.update(user);
        LOG.debugf("Updated profile of user %s", userId);
        return Result.success(user);
    }

    public Optional<User> findById(String userId) {
        return userRepository.findByIdOptional(userId);
    }

    public List<User> listUsers() {
        return userRepository.listAll();
    }

    /**
     * Activate/deactivate an account and grant/revoke administrator rights in one transaction.
     * Deactivation immediately invalidates the user's session tokens and API keys, since both
     * check the owner's active flag on every request.
     *
     * <p>Null leaves a flag unchanged; nothing is written when the change is rejected.
     */
    @Transactional
    public Result<User> updateFlags(String userId, Boolean active, Boolean admin) {
        Optional<User> found = userRepository.findByIdOptional(userId);
        if (found.isEmpty()) {
            return Result.failure(userNotFound(userId));
        }

        User user = found.get();
        boolean newActive = active != null ? active : user.active;
        boolean newAdmin = admin != null ? admin : user.admin;
        boolean losesAdmin = user.admin && user.active && !(newAdmin && newActive);
        if (losesAdmin && userRepository.countActiveAdmins() <= 1) {
            return Result.failure(new UseCaseError.BusinessRuleViolation("LAST_ADMIN",
                "Cannot remove the last active administrator"));
        }

        user.active = newActive;
        user.admin = newAdmin;
        user.updatedAt = clock.instant();
        userRepository.update(user);
        LOG.infof("User %s flags set to active=%s, admin=%s", userId, newActive, newAdmin);
        return Result.success(user);
    }

    private boolean isFirstUser() {
        if (userRepository.countUsers() > 0) {
            return false;
        }
        // Concurrent first registrations queue here; only the first sees an empty table
        userRepository.lockAdminBootstrap();
        return userRepository.countUsers() == 0;
    }

    private String dummyHash() {
        String hash = dummyHash;
        if (hash == null) {
            hash = passwordService.hashPassword(TsidGenerator.generateRaw());
            dummyHash = hash;
        }
        return hash;
    }

    private static UseCaseError userNotFound(String userId) {
        return new UseCaseError.NotFoundError("USER_NOT_FOUND", "User not found", Map.of("userId", userId));
    }
}
