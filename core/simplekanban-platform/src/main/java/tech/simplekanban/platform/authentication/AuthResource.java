package tech.simplekanban.platform.authentication;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.*;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.simplekanban.platform.common.Result;
import tech.simplekanban.platform.common.api.ApiResponses;
import tech.simplekanban.platform.common.api.ApiResponses.MessageResponse;
import tech.simplekanban.platform.common.errors.UseCaseError;
import tech.simplekanban.platform.csrf.CsrfTokenService;
import tech.simplekanban.platform.identity.CredentialRejectedException;
import tech.simplekanban.platform.identity.Principal;
import tech.simplekanban.platform.security.SecurityContextHolder;
import tech.simplekanban.platform.security.SecurityRejectionException;
import tech.simplekanban.platform.user.User;
import tech.simplekanban.platform.user.UserDto;
import tech.simplekanban.platform.user.UserService;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Registration, password login, logout and self-service profile and password changes.
 *
 * <p>Login sets an HttpOnly session cookie and a script-readable CSRF cookie. The CSRF
 * token is also returned in the body; clients echo it in the {@code X-CSRF-Token} header
 * on every state-changing request.
 */
@Path("/api/auth")
@Tag(name = "Authentication", description = "User authentication endpoints")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

    private static final Logger LOG = Logger.getLogger(AuthResource.class);

    @Inject
    AuthConfig authConfig;

    @Inject
    UserService userService;

    @Inject
    SessionTokenService sessionTokenService;

    @Inject
    SessionRevocationService revocationService;

    @Inject
    CsrfTokenService csrfTokenService;

    @Inject
    LoginAttemptLimiter loginAttemptLimiter;

    @Inject
    SecurityContextHolder securityContextHolder;

    @POST
    @Path("/register")
    @Operation(summary = "Register a new user account")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "User registered",
            content = @Content(schema = @Schema(implementation = UserDto.class))),
        @APIResponse(responseCode = "400", description = "Invalid username, email or password"),
        @APIResponse(responseCode = "409", description = "Username or email already registered")
    })
    public Response register(@Valid RegisterRequest request) {
        Result<User> result = userService.register(request.username(), request.email(),
            request.password(), request.fullName());

        if (result instanceof Result.Failure<User> f) {
            return ApiResponses.toResponse(f.error());
        }
        User user = ((Result.Success<User>) result).value();
        return Response.status(Response.Status.CREATED).entity(UserDto.from(user)).build();
    }

    /**
     * Login with username or email and password.
     */
    @POST
    @Path("/login")
    @Operation(summary = "Login with username or email and password")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Login successful",
            content = @Content(schema = @Schema(implementation = LoginResponse.class))),
        @APIResponse(responseCode = "401", description = "Invalid credentials"),
        @APIResponse(responseCode = "429", description = "Too many failed attempts")
    })
    public Response login(@Valid LoginRequest request) {
        LoginAttemptLimiter.ThrottleResult throttle = loginAttemptLimiter.check(request.login());
        if (!throttle.permitted()) {
            throw SecurityRejectionException.rateLimited(throttle.retryAfter());
        }

        User user = userService.authenticate(request.login(), request.password()).orElse(null);
        if (user == null) {
            loginAttemptLimiter.recordFailure(request.login());
            throw SecurityRejectionException.unauthenticated();
        }
        loginAttemptLimiter.recordSuccess(request.login());

        SessionToken session = sessionTokenService.issue(user);
        String csrfToken = csrfTokenService.tokenFor(session.sessionId());
        LOG.infof("Login successful for user %s", user.id);

        return Response.ok(new LoginResponse(UserDto.from(user), csrfToken, session.expiresAt()))
            .cookie(sessionCookie(session.token(), sessionMaxAge()), csrfCookie(csrfToken, sessionMaxAge()))
            .build();
    }

    /**
     * Logout. The session token is added to the revocation list and both cookies are cleared.
     */
    @POST
    @Path("/logout")
    @Operation(summary = "Logout and end the session")
    @APIResponse(responseCode = "200", description = "Logout successful")
    public Response logout(@Context HttpHeaders headers) {
        Principal principal = securityContextHolder.requirePrincipal();
        if (principal.isApiKey()) {
            return ApiResponses.toResponse(new UseCaseError.ValidationError("NOT_A_SESSION",
                "API key requests have no session to end"));
        }

        String token = sessionToken(headers);
        if (token != null) {
            try {
                revocationService.revoke(sessionTokenService.verify(token));
            } catch (CredentialRejectedException e) {
                LOG.debugf("Logout with an unverifiable token: %s", e.failure());
            }
        }
        LOG.infof("User %s logged out", principal.userId());

        return Response.ok(new MessageResponse("Logged out"))
            .cookie(sessionCookie("", 0), csrfCookie("", 0))
            .build();
    }

    @GET
    @Path("/me")
    @Operation(summary = "Get the authenticated user")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Current user",
            content = @Content(schema = @Schema(implementation = MeResponse.class))),
        @APIResponse(responseCode = "401", description = "Not authenticated")
    })
    public Response me() {
        Principal principal = securityContextHolder.requirePrincipal();
        User user = userService.findById(principal.userId())
            .orElseThrow(SecurityRejectionException::unauthenticated);
        return Response.ok(new MeResponse(UserDto.from(user), principal.source().name().toLowerCase(Locale.ROOT),
            principal.scopes())).build();
    }

    @PUT
    @Path("/me")
    @Operation(summary = "Update the authenticated user's email or full name")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Profile updated",
            content = @Content(schema = @Schema(implementation = UserDto.class))),
        @APIResponse(responseCode = "400", description = "Invalid email"),
        @APIResponse(responseCode = "409", description = "Email already registered")
    })
    public Response updateProfile(@Valid UpdateProfileRequest request) {
        Principal principal = securityContextHolder.requirePrincipal();
        Result<User> result = userService.updateProfile(principal.userId(), request.email(), request.fullName());

        if (result instanceof Result.Failure<User> f) {
            return ApiResponses.toResponse(f.error());
        }
        return Response.ok(UserDto.from(((Result.Success<User>) result).value())).build();
    }

    /**
     * Change the password. Every session issued before the change stops working; a session
     * caller receives fresh session and CSRF cookies so only this browser stays signed in.
     */
    @POST
    @Path("/change-password")
    @Operation(summary = "Change the authenticated user's password")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Password changed",
            content = @Content(schema = @Schema(implementation = PasswordChangedResponse.class))),
        @APIResponse(responseCode = "400", description = "Current password wrong or new password too weak"),
        @APIResponse(responseCode = "401", description = "Not authenticated")
    })
    public Response changePassword(@Valid ChangePasswordRequest request) {
        Principal principal = securityContextHolder.requirePrincipal();
        Result<User> result = userService.changePassword(principal.userId(),
            request.currentPassword(), request.newPassword());

        if (result instanceof Result.Failure<User> f) {
            return ApiResponses.toResponse(f.error());
        }
        if (principal.isApiKey()) {
            return Response.ok(new PasswordChangedResponse("Password changed", null, null)).build();
        }

        SessionToken session = sessionTokenService.issue(((Result.Success<User>) result).value());
        String csrfToken = csrfTokenService.tokenFor(session.sessionId());
        return Response.ok(new PasswordChangedResponse("Password changed", csrfToken, session.expiresAt()))
            .cookie(sessionCookie(session.token(), sessionMaxAge()), csrfCookie(csrfToken, sessionMaxAge()))
            .build();
    }

    /**
     * Re-issue the CSRF token of the current session, e.g. after the page reloaded.
     */
    @GET
    @Path("/csrf-token")
    @Operation(summary = "Get the CSRF token bound to the current session")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "CSRF token",
            content = @Content(schema = @Schema(implementation = CsrfTokenResponse.class))),
        @APIResponse(responseCode = "400", description = "Not a browser session"),
        @APIResponse(responseCode = "401", description = "Not authenticated")
    })
    public Response csrfToken() {
        Principal principal = securityContextHolder.requirePrincipal();
        if (principal.isApiKey()) {
            return ApiResponses.toResponse(new UseCaseError.ValidationError("NOT_A_SESSION",
                "API key requests do not use CSRF tokens"));
        }
        String token = csrfTokenService.tokenFor(principal.sessionId());
        return Response.ok(new CsrfTokenResponse(token, authConfig.csrf().headerName())).build();
    }

    private String sessionToken(HttpHeaders headers) {
        String authorization = headers.getHeaderString(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return authorization.substring(7).trim();
        }
        Cookie cookie = headers.getCookies().get(authConfig.session().cookieName());
        return cookie != null ? cookie.getValue() : null;
    }

    private int sessionMaxAge() {
        return (int) authConfig.session().lifetime().toSeconds();
    }

    private NewCookie sessionCookie(String value, int maxAge) {
        return new NewCookie.Builder(authConfig.session().cookieName())
            .value(value)
            .path("/")
            .maxAge(maxAge)
            .httpOnly(true)
            .secure(authConfig.session().secureCookie())
            .sameSite(sameSite())
            .build();
    }

    // Readable by scripts so the page can echo it back in the header
    private NewCookie csrfCookie(String value, int maxAge) {
        return new NewCookie.Builder(authConfig.csrf().cookieName())
            .value(value)
            .path("/")
            .maxAge(maxAge)
            .httpOnly(false)
            .secure(authConfig.session().secureCookie())
            .sameSite(sameSite())
            .build();
    }

    private NewCookie.SameSite sameSite() {
        return NewCookie.SameSite.valueOf(authConfig.session().sameSite().toUpperCase(Locale.ROOT));
    }

    // ==================== DTOs ====================

    public record RegisterRequest(
        @NotBlank(message = "Username is required")
        @Size(max = 50, message = "Username must be at most 50 characters")
        String username,

        @NotBlank(message = "Email is required")
        String email,

        @NotBlank(message = "Password is required")
        String password,

        @Size(max = 200, message = "Full name must be at most 200 characters")
        String fullName
    ) {}

    public record LoginRequest(
        @NotBlank(message = "Username or email is required")
        String login,

        @NotBlank(message = "Password is required")
        String password
    ) {
        @Override
        public String toString() {
            return "LoginRequest[login=" + login + "]";
        }
    }

    public record UpdateProfileRequest(
        String email,

        @Size(max = 200, message = "Full name must be at most 200 characters")
        String fullName
    ) {}

    public record ChangePasswordRequest(
        @NotBlank(message = "Current password is required")
        String currentPassword,

        @NotBlank(message = "New password is required")
        String newPassword
    ) {
        @Override
        public String toString() {
            return "ChangePasswordRequest[***]";
        }
    }

    /** {@code csrfToken} and {@code expiresAt} are set only when a new session was issued. */
    public record PasswordChangedResponse(
        String message,
        String csrfToken,
        Instant expiresAt
    ) {}

    public record LoginResponse(
        UserDto user,
        String csrfToken,
        Instant expiresAt
    ) {}

    public record MeResponse(
        UserDto user,
        String authenticatedWith,
        List<String> scopes
    ) {}

    public record CsrfTokenResponse(
        String csrfToken,
        String headerName
    ) {}
}
