package tech.simplekanban.platform.admin;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.*;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.simplekanban.platform.authorization.AuthorizationEngine;
import tech.simplekanban.platform.authorization.Capability;
import tech.simplekanban.platform.authorization.ResourceRef;
import tech.simplekanban.platform.common.Result;
import tech.simplekanban.platform.common.api.ApiResponses;
import tech.simplekanban.platform.identity.Principal;
import tech.simplekanban.platform.security.SecurityContextHolder;
import tech.simplekanban.platform.user.User;
import tech.simplekanban.platform.user.UserDto;
import tech.simplekanban.platform.user.UserService;

import java.util.List;

/**
 * Admin API for user accounts. Every operation requires the administrator flag
 * (and, for API keys, the admin scope).
 */
@Path("/api/admin/users")
@Tag(name = "Admin - Users", description = "Administrative operations on user accounts")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AdminUserResource {

    private static final Logger LOG = Logger.getLogger(AdminUserResource.class);

    @Inject
    UserService userService;

    @Inject
    AuthorizationEngine authorizationEngine;

    @Inject
    SecurityContextHolder securityContextHolder;

    @GET
    @Operation(summary = "List all users")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Users",
            content = @Content(schema = @Schema(implementation = UserListResponse.class))),
        @APIResponse(responseCode = "401", description = "Not authenticated"),
        @APIResponse(responseCode = "403", description = "Insufficient permissions")
    })
    public Response listUsers() {
        requireAdministrator();

        List<UserDto> users = userService.listUsers().stream()
            .map(UserDto::from)
            .toList();
        return Response.ok(new UserListResponse(users, users.size())).build();
    }

    @GET
    @Path("/stats")
    @Operation(summary = "User account statistics")
    @APIResponse(responseCode = "200", description = "Statistics",
        content = @Content(schema = @Schema(implementation = UserStatsResponse.class)))
    public Response userStats() {
        requireAdministrator();

        List<User> users = userService.listUsers();
        long active = users.stream().filter(u -> u.active).count();
        long admins = users.stream().filter(u -> u.admin && u.active).count();
        return Response.ok(new UserStatsResponse(users.size(), active, users.size() - active, admins)).build();
    }

    /**
     * Activate/deactivate a user and/or grant/revoke administrator rights. Absent fields
     * are left unchanged.
     */
    @PATCH
    @Path("/{id}")
    @Operation(summary = "Update a user's active and administrator flags")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "User updated",
            content = @Content(schema = @Schema(implementation = UserDto.class))),
        @APIResponse(responseCode = "403", description = "Insufficient permissions"),
        @APIResponse(responseCode = "404", description = "User not found"),
        @APIResponse(responseCode = "409", description = "Would remove the last active administrator")
    })
    public Response updateUser(@PathParam("id") String id, UpdateUserRequest request) {
        Principal principal = requireAdministrator();

        Result<User> result = userService.updateFlags(id, request.active(), request.admin());
        if (result instanceof Result.Failure<User> f) {
            return ApiResponses.toResponse(f.error());
        }

        LOG.infof("User %s updated by administrator %s (active=%s, admin=%s)",
            id, principal.userId(), request.active(), request.admin());
        return Response.ok(UserDto.from(((Result.Success<User>) result).value())).build();
    }

    private Principal requireAdministrator() {
        Principal principal = securityContextHolder.requirePrincipal();
        authorizationEngine.require(principal, ResourceRef.SYSTEM, Capability.ADMINISTER);
        return principal;
    }

    // ==================== DTOs ====================

    public record UserListResponse(
        List<UserDto> users,
        int total
    ) {}

    public record UserStatsResponse(
        long totalUsers,
        long activeUsers,
        long inactiveUsers,
        long administrators
    ) {}

    public record UpdateUserRequest(
        @Schema(description = "Activate (true) or deactivate (false) the account")
        Boolean active,
        @Schema(description = "Grant (true) or revoke (false) administrator rights")
        Boolean admin
    ) {}
}
