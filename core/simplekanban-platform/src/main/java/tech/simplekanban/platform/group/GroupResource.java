package tech.simplekanban.platform.group;

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
import tech.simplekanban.platform.authorization.AuthorizationEngine;
import tech.simplekanban.platform.authorization.Capability;
import tech.simplekanban.platform.authorization.ResourceRef;
import tech.simplekanban.platform.common.Result;
import tech.simplekanban.platform.common.api.ApiResponses;
import tech.simplekanban.platform.common.api.ApiResponses.DeleteResponse;
import tech.simplekanban.platform.common.errors.UseCaseError;
import tech.simplekanban.platform.identity.Principal;
import tech.simplekanban.platform.security.SecurityContextHolder;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Groups and their memberships.
 *
 * <ul>
 *   <li>Any member can read the group and its member list</li>
 *   <li>Owners and admins can rename it and manage members</li>
 *   <li>Only owners can delete it or grant and revoke ownership</li>
 *   <li>Any member can leave</li>
 * </ul>
 */
@Path("/api/groups")
@Tag(name = "Groups", description = "Group and membership management")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class GroupResource {

    private static final Logger LOG = Logger.getLogger(GroupResource.class);

    @Inject
    GroupService groupService;

    @Inject
    AuthorizationEngine authorizationEngine;

    @Inject
    SecurityContextHolder securityContextHolder;

    @GET
    @Operation(summary = "List groups the current user belongs to")
    @APIResponse(responseCode = "200", description = "Groups",
        content = @Content(schema = @Schema(implementation = GroupListResponse.class)))
    public Response listGroups() {
        Principal principal = securityContextHolder.requirePrincipal();
        authorizationEngine.require(principal, ResourceRef.user(principal.userId()), Capability.READ);

        List<GroupDto> groups = groupService.listForUser(principal.userId()).stream()
            .map(GroupDto::from)
            .toList();
        return Response.ok(new GroupListResponse(groups, groups.size())).build();
    }

    @POST
    @Operation(summary = "Create a group", description = "The caller becomes its owner")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Group created",
            content = @Content(schema = @Schema(implementation = GroupDto.class))),
        @APIResponse(responseCode = "400", description = "Invalid name")
    })
    public Response createGroup(@Valid GroupRequest request, @Context UriInfo uriInfo) {
        Principal principal = securityContextHolder.requirePrincipal();
        authorizationEngine.require(principal, ResourceRef.user(principal.userId()), Capability.WRITE);

        Result<Group> result = groupService.create(principal.userId(), request.name(), request.description());
        if (result instanceof Result.Failure<Group> f) {
            return ApiResponses.toResponse(f.error());
        }
        Group group = ((Result.Success<Group>) result).value();
        return Response.status(Response.Status.CREATED)
            .entity(GroupDto.from(group))
            .location(uriInfo.getAbsolutePathBuilder().path(group.id).build())
            .build();
    }

    @GET
    @Path("/{id}")
    @Operation(summary = "Get a group")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Group",
            content = @Content(schema = @Schema(implementation = GroupDto.class))),
        @APIResponse(responseCode = "403", description = "Access denied")
    })
    public Response getGroup(@PathParam("id") String id) {
        Principal principal = securityContextHolder.requirePrincipal();
        authorizationEngine.require(principal, ResourceRef.group(id), Capability.READ);

        return groupService.findById(id)
            .map(group -> Response.ok(GroupDto.from(group)).build())
            .orElseGet(() -> groupNotFound(id));
    }

    @PATCH
    @Path("/{id}")
    @Operation(summary = "Rename or describe a group")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Group updated"),
        @APIResponse(responseCode = "400", description = "Invalid name"),
        @APIResponse(responseCode = "403", description = "Access denied")
    })
    public Response updateGroup(@PathParam("id") String id, @Valid UpdateGroupRequest request) {
        Principal principal = securityContextHolder.requirePrincipal();
        authorizationEngine.require(principal, ResourceRef.group(id), Capability.WRITE);

        Result<Group> result = groupService.update(id, request.name(), request.description());
        if (result instanceof Result.Failure<Group> f) {
            return ApiResponses.toResponse(f.error());
        }
        return Response.ok(GroupDto.from(((Result.Success<Group>) result).value())).build();
    }

    @DELETE
    @Path("/{id}")
    @Operation(summary = "Delete a group", description = "Boards owned by the group are unlinked, not deleted")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Group deleted"),
        @APIResponse(responseCode = "403", description = "Access denied")
    })
    public Response deleteGroup(@PathParam("id") String id) {
        Principal principal = securityContextHolder.requirePrincipal();
        authorizationEngine.require(principal, ResourceRef.group(id), Capability.DELETE);

        Result<String> result = groupService.delete(id);
        if (result instanceof Result.Failure<String> f) {
            return ApiResponses.toResponse(f.error());
        }
        LOG.infof("Group %s deleted by %s", id, principal.userId());
        return Response.ok(new DeleteResponse(id, "group")).build();
    }

    // ==================== Members ====================

    @GET
    @Path("/{id}/members")
    @Operation(summary = "List group members")
    @APIResponse(responseCode = "200", description = "Members",
        content = @Content(schema = @Schema(implementation = MemberListResponse.class)))
    public Response listMembers(@PathParam("id") String id) {
        Principal principal = securityContextHolder.requirePrincipal();
        authorizationEngine.require(principal, ResourceRef.group(id), Capability.READ);

        List<MemberDto> members = groupService.listMembers(id).stream()
            .map(MemberDto::from)
            .toList();
        return Response.ok(new MemberListResponse(members, members.size())).build();
    }

    @POST
    @Path("/{id}/members")
    @Operation(summary = "Add a member to a group")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Member added",
            content = @Content(schema = @Schema(implementation = MemberDto.class))),
        @APIResponse(responseCode = "400", description = "Invalid role"),
        @APIResponse(responseCode = "403", description = "Access denied"),
        @APIResponse(responseCode = "404", description = "Group or user not found"),
        @APIResponse(responseCode = "409", description = "Already a member")
    })
    public Response addMember(@PathParam("id") String id, @Valid AddMemberRequest request) {
        Principal principal = securityContextHolder.requirePrincipal();
        Optional<GroupRole> role = request.role() == null ? Optional.of(GroupRole.MEMBER)
            : GroupRole.fromValue(request.role());
        if (role.isEmpty()) {
            return invalidRole(request.role());
        }
        authorizationEngine.require(principal, ResourceRef.group(id), capabilityToAssign(role.get()));

        Result<GroupMembership> result = groupService.addMember(id, request.userId(), role.get());
        if (result instanceof Result.Failure<GroupMembership> f) {
            return ApiResponses.toResponse(f.error());
        }
        return Response.status(Response.Status.CREATED)
            .entity(MemberDto.from(((Result.Success<GroupMembership>) result).value()))
            .build();
    }

    @PUT
    @Path("/{id}/members/{userId}/role")
    @Operation(summary = "Change a member's role")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Role changed"),
        @APIResponse(responseCode = "400", description = "Invalid role"),
        @APIResponse(responseCode = "403", description = "Access denied"),
        @APIResponse(responseCode = "404", description = "Membership not found"),
        @APIResponse(responseCode = "409", description = "Would leave the group without an owner")
    })
    public Response changeRole(@PathParam("id") String id, @PathParam("userId") String userId,
                               @Valid ChangeRoleRequest request) {
        Principal principal = securityContextHolder.requirePrincipal();
        Optional<GroupRole> role = GroupRole.fromValue(request.role());
        if (role.isEmpty()) {
            return invalidRole(request.role());
        }

        Capability required = capabilityToAssign(role.get());
        Optional<GroupMembership> current = groupService.listMembers(id).stream()
            .filter(m -> m.userId.equals(userId))
            .findFirst();
        if (current.isPresent() && current.get().role == GroupRole.OWNER) {
            required = Capability.DELETE;
        }
        authorizationEngine.require(principal, ResourceRef.group(id), required);

        Result<GroupMembership> result = groupService.changeRole(id, userId, role.get());
        if (result instanceof Result.Failure<GroupMembership> f) {
            return ApiResponses.toResponse(f.error());
        }
        return Response.ok(MemberDto.from(((Result.Success<GroupMembership>) result).value())).build();
    }

    @DELETE
    @Path("/{id}/members/{userId}")
    @Operation(summary = "Remove a member, or leave the group")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Member removed"),
        @APIResponse(responseCode = "403", description = "Access denied"),
        @APIResponse(responseCode = "404", description = "Membership not found"),
        @APIResponse(responseCode = "409", description = "Would leave the group without an owner")
    })
    public Response removeMember(@PathParam("id") String id, @PathParam("userId") String userId) {
        Principal principal = securityContextHolder.requirePrincipal();
        boolean leaving = principal.userId().equals(userId);
        authorizationEngine.require(principal, ResourceRef.group(id),
            leaving ? Capability.READ : Capability.MANAGE_MEMBERS);

        Result<String> result = groupService.removeMember(id, userId);
        if (result instanceof Result.Failure<String> f) {
            return ApiResponses.toResponse(f.error());
        }
        return Response.ok(new DeleteResponse(userId, "group membership")).build();
    }

    // Ownership changes hands only through owners
    private static Capability capabilityToAssign(GroupRole role) {
        return role == GroupRole.OWNER ? Capability.DELETE : Capability.MANAGE_MEMBERS;
    }

    private static Response invalidRole(String role) {
        return ApiResponses.toResponse(new UseCaseError.ValidationError("INVALID_ROLE",
            "Role must be one of owner, admin, member", Map.of("role", String.valueOf(role))));
    }

    private static Response groupNotFound(String id) {
        return ApiResponses.toResponse(new UseCaseError.NotFoundError("GROUP_NOT_FOUND", "Group not found",
            Map.of("groupId", id)));
    }

    // ==================== DTOs ====================

    public record GroupDto(
        String id,
        String name,
        String description,
        Instant createdAt,
        Instant updatedAt
    ) {
        static GroupDto from(Group group) {
            return new GroupDto(group.id, group.name, group.description, group.createdAt, group.updatedAt);
        }
    }

    public record GroupListResponse(
        List<GroupDto> groups,
        int total
    ) {}

    public record MemberDto(
        String userId,
        String role,
        Instant joinedAt
    ) {
        static MemberDto from(GroupMembership membership) {
            return new MemberDto(membership.userId, membership.role.value(), membership.createdAt);
        }
    }

    public record MemberListResponse(
        List<MemberDto> members,
        int total
    ) {}

    public record GroupRequest(
        @NotBlank(message = "Name is required")
        @Size(max = 100, message = "Name must be at most 100 characters")
        String name,

        @Size(max = 500, message = "Description must be at most 500 characters")
        String description
    ) {}

    public record UpdateGroupRequest(
        @Size(max = 100, message = "Name must be at most 100 characters")
        String name,

        @Size(max = 500, message = "Description must be at most 500 characters")
        String description
    ) {}

    public record AddMemberRequest(
        @NotBlank(message = "User ID is required")
        String userId,

        @Schema(description = "owner, admin or member", defaultValue = "member")
        String role
    ) {}

    public record ChangeRoleRequest(
        @NotBlank(message = "Role is required")
        String role
    ) {}
}
