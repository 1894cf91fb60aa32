package tech.simplekanban.platform.user;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.simplekanban.platform.common.Result;
import tech.simplekanban.platform.common.errors.UseCaseError;
import tech.simplekanban.platform.testing.Fixtures;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for UserService.
 * Password hashing and persistence are mocked.
 */
@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");

    @Mock
    UserRepository userRepository;

    @Mock
    PasswordService passwordService;

    @InjectMocks
    UserService service;

    @BeforeEach
    void setUp() {
        service.clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    // ========================================
    // register TESTS
    // ========================================

    @Test
    @DisplayName("register should make the very first account the administrator")
    void register_shouldGrantAdmin_whenFirstUser() {
        // Arrange
        when(passwordService.validateAndHashPassword("s3cret-pass")).thenReturn("$argon2id$hash");
        when(userRepository.countUsers()).thenReturn(0L);

        // Act
        Result<User> result = service.register("alice", "Alice@Example.com", "s3cret-pass", "Alice");

        // Assert
        User user = ((Result.Success<User>) result).value();
        assertThat(user.admin).isTrue();
        assertThat(user.active).isTrue();
        assertThat(user.email).isEqualTo("alice@example.com");
        assertThat(user.passwordHash).isEqualTo("$argon2id$hash");
        assertThat(user.id).startsWith("usr_");
        verify(userRepository).lockAdminBootstrap();
        verify(userRepository).persist(user);
    }

    @Test
    @DisplayName("register should create regular users once an account exists")
    void register_shouldNotGrantAdmin_whenUsersExist() {
        when(passwordService.validateAndHashPassword(anyString())).thenReturn("$argon2id$hash");
        when(userRepository.countUsers()).thenReturn(3L);

        Result<User> result = service.register("bob", "bob@example.com", "s3cret-pass", null);

        assertThat(((Result.Success<User>) result).value().admin).isFalse();
        verify(userRepository, never()).lockAdminBootstrap();
    }

    @Test
    @DisplayName("register should not grant admin when a concurrent registration committed first")
    void register_shouldNotGrantAdmin_whenFirstUserRaceLost() {
        // Arrange
        when(passwordService.validateAndHashPassword(anyString())).thenReturn("$argon2id$hash");
        when(userRepository.countUsers()).thenReturn(0L, 1L);

        // Act
        Result<User> result = service.register("carol", "carol@example.com", "s3cret-pass", null);

        // Assert
        assertThat(((Result.Success<User>) result).value().admin).isFalse();
        verify(userRepository).lockAdminBootstrap();
    }

    @Test
    @DisplayName("register should reject a taken username without persisting")
    void register_shouldFail_whenUsernameTaken() {
        // Arrange
        when(passwordService.validateAndHashPassword(anyString())).thenReturn("$argon2id$hash");
        when(userRepository.existsByUsername("alice")).thenReturn(true);

        // Act
        Result<User> result = service.register("alice", "alice@example.com", "s3cret-pass", null);

        // Assert
        assertThat(((Result.Failure<User>) result).error().code()).isEqualTo("USERNAME_TAKEN");
        verify(userRepository, never()).persist(any());
    }

    @Test
    @DisplayName("register should report a weak password as a validation error")
    void register_shouldFail_whenPasswordWeak() {
        when(passwordService.validateAndHashPassword("short"))
            .thenThrow(new IllegalArgumentException("password needs at least 8 characters"));

        Result<User> result = service.register("alice", "alice@example.com", "short", null);

        UseCaseError error = ((Result.Failure<User>) result).error();
        assertThat(error).isInstanceOf(UseCaseError.ValidationError.class);
        assertThat(error.code()).isEqualTo("WEAK_PASSWORD");
    }

    @Test
    @DisplayName("register should reject malformed usernames and emails")
    void register_shouldFail_whenIdentifiersInvalid() {
        assertThat(((Result.Failure<User>) service.register("a", "a@example.com", "s3cret-pass", null))
            .error().code()).isEqualTo("INVALID_USERNAME");
        assertThat(((Result.Failure<User>) service.register("alice", "not-an-email", "s3cret-pass", null))
            .error().code()).isEqualTo("INVALID_EMAIL");
        verifyNoInteractions(passwordService);
    }

    // ========================================
    // authenticate TESTS
    // ========================================

    @Test
    @DisplayName("authenticate should look up by email when the login contains @")
    void authenticate_shouldReturnUser_whenEmailAndPasswordMatch() {
        // Arrange
        User user = Fixtures.user("usr_1", true, false);
        when(userRepository.findByEmail("usr_1@example.com")).thenReturn(Optional.of(user));
        when(passwordService.verifyPassword("pw", user.passwordHash)).thenReturn(true);
        when(passwordService.needsRehash(user.passwordHash)).thenReturn(false);

        // Act & Assert
        assertThat(service.authenticate("usr_1@example.com", "pw")).contains(user);
    }

    @Test
    @DisplayName("authenticate should still verify against a dummy hash when the account is unknown")
    void authenticate_shouldSpendHashingWork_whenUserUnknown() {
        // Arrange
        when(userRepository.findByUsername("ghost")).thenReturn(Optional.empty());
        when(passwordService.hashPassword(anyString())).thenReturn("$argon2id$dummy");

        // Act
        Optional<User> result = service.authenticate("ghost", "pw");

        // Assert
        assertThat(result).isEmpty();
        verify(passwordService).verifyPassword("pw", "$argon2id$dummy");
    }

    @Test
    @DisplayName("authenticate should refuse an inactive account even with the right password")
    void authenticate_shouldReturnEmpty_whenUserInactive() {
        User user = Fixtures.user("usr_1", false, false);
        when(userRepository.findByUsername("alice")).thenReturn(Optional.of(user));
        when(passwordService.verifyPassword("pw", user.passwordHash)).thenReturn(true);

        assertThat(service.authenticate("alice", "pw")).isEmpty();
    }

    @Test
    @DisplayName("authenticate should upgrade an outdated password hash on success")
    void authenticate_shouldRehash_whenParametersOutdated() {
        // Arrange
        User user = Fixtures.user("usr_1", true, false);
        when(userRepository.findByUsername("alice")).thenReturn(Optional.of(user));
        when(passwordService.verifyPassword("pw", "$argon2id$stub")).thenReturn(true);
        when(passwordService.needsRehash("$argon2id$stub")).thenReturn(true);
        when(passwordService.hashPassword("pw")).thenReturn("$argon2id$new");

        // Act
        service.authenticate("alice", "pw");

        // Assert
        assertThat(user.passwordHash).isEqualTo("$argon2id$new");
        verify(userRepository).update(user);
    }

    // ========================================
    // changePassword TESTS
    // ========================================

    @Test
    @DisplayName("changePassword should store the new hash and mark earlier sessions as revoked")
    void changePassword_shouldRehashAndStampChange_whenCurrentPasswordMatches() {
        // Arrange
        User user = Fixtures.user("usr_1", true, false);
        service.clock = Clock.fixed(NOW.plusMillis(750), ZoneOffset.UTC);
        when(userRepository.findByIdOptional("usr_1")).thenReturn(Optional.of(user));
        when(passwordService.verifyPassword("old-pass-1", "$argon2id$stub")).thenReturn(true);
        when(passwordService.validateAndHashPassword("new-pass-2")).thenReturn("$argon2id$new");

        // Act
        Result<User> result = service.changePassword("usr_1", "old-pass-1", "new-pass-2");

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(user.passwordHash).isEqualTo("$argon2id$new");
        assertThat(user.credentialsChangedAt).isEqualTo(NOW);
        verify(userRepository).update(user);
    }

    @Test
    @DisplayName("changePassword should reject a wrong current password without touching the hash")
    void changePassword_shouldFail_whenCurrentPasswordWrong() {
        // Arrange
        User user = Fixtures.user("usr_1", true, false);
        when(userRepository.findByIdOptional("usr_1")).thenReturn(Optional.of(user));
        when(passwordService.verifyPassword("guess", "$argon2id$stub")).thenReturn(false);

        // Act
        Result<User> result = service.changePassword("usr_1", "guess", "new-pass-2");

        // Assert
        assertThat(((Result.Failure<User>) result).error().code()).isEqualTo("INVALID_CURRENT_PASSWORD");
        assertThat(user.passwordHash).isEqualTo("$argon2id$stub");
        assertThat(user.credentialsChangedAt).isNull();
        verify(passwordService, never()).validateAndHashPassword(anyString());
        verify(userRepository, never()).update(any());
    }

    @Test
    @DisplayName("changePassword should reject a new password that fails the complexity rules")
    void changePassword_shouldFail_whenNewPasswordWeak() {
        // Arrange
        when(userRepository.findByIdOptional("usr_1")).thenReturn(Optional.of(Fixtures.user("usr_1", true, false)));
        when(passwordService.verifyPassword("old-pass-1", "$argon2id$stub")).thenReturn(true);
        when(passwordService.validateAndHashPassword("short"))
            .thenThrow(new IllegalArgumentException("password needs at least 8 characters"));

        // Act
        Result<User> result = service.changePassword("usr_1", "old-pass-1", "short");

        // Assert
        assertThat(((Result.Failure<User>) result).error())
            .isInstanceOf(UseCaseError.ValidationError.class)
            .extracting(UseCaseError::code).isEqualTo("WEAK_PASSWORD");
        verify(userRepository, never()).update(any());
    }

    @Test
    @DisplayName("changePassword should fail with USER_NOT_FOUND for an unknown user")
    void changePassword_shouldFail_whenUserMissing() {
        when(userRepository.findByIdOptional("usr_x")).thenReturn(Optional.empty());

        Result<User> result = service.changePassword("usr_x", "a", "b");

        assertThat(((Result.Failure<User>) result).error().code()).isEqualTo("USER_NOT_FOUND");
    }

    // ========================================
    // updateProfile TESTS
    // ========================================

    @Test
    @DisplayName("updateProfile should change email and full name")
    void updateProfile_shouldUpdateFields_whenEmailFree() {
        // Arrange
        User user = Fixtures.user("usr_1", true, false);
        when(userRepository.findByIdOptional("usr_1")).thenReturn(Optional.of(user));
        when(userRepository.existsByEmail("New@Example.com")).thenReturn(false);

        // Act
        Result<User> result = service.updateProfile("usr_1", "New@Example.com", "  Alice Liddell ");

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(user.email).isEqualTo("new@example.com");
        assertThat(user.fullName).isEqualTo("Alice Liddell");
        verify(userRepository).update(user);
    }

    @Test
    @DisplayName("updateProfile should reject an email held by another account")
    void updateProfile_shouldFail_whenEmailTaken() {
        // Arrange
        User user = Fixtures.user("usr_1", true, false);
        when(userRepository.findByIdOptional("usr_1")).thenReturn(Optional.of(user));
        when(userRepository.existsByEmail("bob@example.com")).thenReturn(true);

        // Act
        Result<User> result = service.updateProfile("usr_1", "bob@example.com", null);

        // Assert
        assertThat(((Result.Failure<User>) result).error().code()).isEqualTo("EMAIL_TAKEN");
        assertThat(user.email).isEqualTo("usr_1@example.com");
        verify(userRepository, never()).update(any());
    }

    @Test
    @DisplayName("updateProfile should not treat the user's own email in other casing as taken")
    void updateProfile_shouldKeepEmail_whenOnlyCaseDiffers() {
        // Arrange
        User user = Fixtures.user("usr_1", true, false);
        when(userRepository.findByIdOptional("usr_1")).thenReturn(Optional.of(user));

        // Act
        Result<User> result = service.updateProfile("usr_1", "USR_1@example.com", null);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        verify(userRepository, never()).existsByEmail(anyString());
    }

    @Test
    @DisplayName("updateProfile should reject a malformed email")
    void updateProfile_shouldFail_whenEmailInvalid() {
        when(userRepository.findByIdOptional("usr_1")).thenReturn(Optional.of(Fixtures.user("usr_1", true, false)));

        Result<User> result = service.updateProfile("usr_1", "not-an-email", null);

        assertThat(((Result.Failure<User>) result).error().code()).isEqualTo("INVALID_EMAIL");
    }

    // ========================================
    // updateFlags TESTS
    // ========================================

    @Test
    @DisplayName("updateFlags should refuse to demote the last active administrator")
    void updateFlags_shouldFail_whenDemotingLastAdmin() {
        // Arrange
        User admin = Fixtures.user("usr_1", true, true);
        when(userRepository.findByIdOptional("usr_1")).thenReturn(Optional.of(admin));
        when(userRepository.countActiveAdmins()).thenReturn(1L);

        // Act
        Result<User> result = service.updateFlags("usr_1", null, false);

        // Assert
        assertThat(((Result.Failure<User>) result).error().code()).isEqualTo("LAST_ADMIN");
        assertThat(admin.admin).isTrue();
        verify(userRepository, never()).update(any());
    }

    @Test
    @DisplayName("updateFlags should refuse to deactivate the last active administrator")
    void updateFlags_shouldFail_whenDeactivatingLastAdmin() {
        User admin = Fixtures.user("usr_1", true, true);
        when(userRepository.findByIdOptional("usr_1")).thenReturn(Optional.of(admin));
        when(userRepository.countActiveAdmins()).thenReturn(1L);

        Result<User> result = service.updateFlags("usr_1", false, null);

        assertThat(result.isFailure()).isTrue();
        assertThat(admin.active).isTrue();
    }

    @Test
    @DisplayName("updateFlags should apply both flags together when another admin remains")
    void updateFlags_shouldUpdate_whenAnotherAdminExists() {
        // Arrange
        User admin = Fixtures.user("usr_1", true, true);
        when(userRepository.findByIdOptional("usr_1")).thenReturn(Optional.of(admin));
        when(userRepository.countActiveAdmins()).thenReturn(2L);
        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);

        // Act
        Result<User> result = service.updateFlags("usr_1", false, false);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        verify(userRepository).update(captor.capture());
        assertThat(captor.getValue().active).isFalse();
        assertThat(captor.getValue().admin).isFalse();
        assertThat(captor.getValue().updatedAt).isEqualTo(NOW);
    }

    @Test
    @DisplayName("updateFlags should not count admins when promoting a regular user")
    void updateFlags_shouldSkipAdminCount_whenPromoting() {
        User user = Fixtures.user("usr_2", true, false);
        when(userRepository.findByIdOptional("usr_2")).thenReturn(Optional.of(user));

        Result<User> result = service.updateFlags("usr_2", null, true);

        assertThat(((Result.Success<User>) result).value().admin).isTrue();
        verify(userRepository, never()).countActiveAdmins();
    }

    @Test
    @DisplayName("updateFlags should fail for an unknown user")
    void updateFlags_shouldFail_whenUserMissing() {
        when(userRepository.findByIdOptional("usr_x")).thenReturn(Optional.empty());

        Result<User> result = service.updateFlags("usr_x", true, null);

        assertThat(((Result.Failure<User>) result).error()).isInstanceOf(UseCaseError.NotFoundError.class);
    }
}
