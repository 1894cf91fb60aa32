package tech.simplekanban.platform.apikey;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
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
import tech.simplekanban.platform.security.SecurityRejectionException;
import tech.simplekanban.platform.user.User;
import tech.simplekanban.platform.user.UserService;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * API key management for the authenticated user.
 *
 * <p>The plaintext secret is only ever returned by the create call.
 */
@Path("/api/api-keys")
@Tag(name = "API Keys", description = "Programmatic access keys")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ApiKeyResource {

    private static final Logger LOG = Logger.getLogger(ApiKeyResource.class);

    @Inject
    ApiKeyService apiKeyService;

    @Inject
    UserService userService;

    @Inject
    AuthorizationEngine authorizationEngine;

    @Inject
    SecurityContextHolder securityContextHolder;

    @GET
    @Operation(summary = "List the current user's API keys")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "API keys",
            content = @Content(schema = @Schema(implementation = ApiKeyListResponse.class))),
        @APIResponse(responseCode = "401", description = "Not authenticated")
    })
    public Response listKeys() {
        Principal principal = securityContextHolder.requirePrincipal();
        authorizationEngine.require(principal, ResourceRef.user(principal.userId()), Capability.READ);

        List<ApiKeyDto> keys = apiKeyService.listForUser(principal.userId()).stream()
            .map(ApiKeyDto::from)
            .toList();
        return Response.ok(new ApiKeyListResponse(keys, keys.size())).build();
    }

    @POST
    @Operation(summary = "Create an API key", description = "The secret is returned once and cannot be retrieved later")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "API key created",
            content = @Content(schema = @Schema(implementation = CreatedApiKeyResponse.class))),
        @APIResponse(responseCode = "400", description = "Invalid name, scopes or expiry"),
        @APIResponse(responseCode = "403", description = "Requested scopes exceed the caller's permissions")
    })
    public Response createKey(@Valid CreateApiKeyRequest request, @Context UriInfo uriInfo) {
        Principal principal = securityContextHolder.requirePrincipal();
        authorizationEngine.require(principal, ResourceRef.user(principal.userId()), Capability.WRITE);

        // A key can only mint keys within its own scopes
        if (principal.isApiKey() && !principal.scopes().containsAll(request.scopes())) {
            return ApiResponses.toResponse(new UseCaseError.AuthorizationError("INVALID_SCOPES",
                "Requested scopes exceed the calling key's scopes"));
        }

        User owner = userService.findById(principal.userId())
            .orElseThrow(SecurityRejectionException::unauthenticated);
        Result<IssuedApiKey> result = apiKeyService.issue(owner, request.name(), request.description(),
            request.scopes(), request.expiresInDays());

        if (result instanceof Result.Failure<IssuedApiKey> f) {
            return ApiResponses.toResponse(f.error());
        }
        IssuedApiKey issued = ((Result.Success<IssuedApiKey>) result).value();
        return Response.status(Response.Status.CREATED)
            .entity(new CreatedApiKeyResponse(ApiKeyDto.from(issued.apiKey()), issued.plaintext()))
            .location(uriInfo.getAbsolutePathBuilder().path(issued.apiKey().id).build())
            .build();
    }

    @GET
    @Path("/stats")
    @Operation(summary = "Usage statistics over the current user's API keys")
    @APIResponse(responseCode = "200", description = "Usage statistics",
        content = @Content(schema = @Schema(implementation = ApiKeyUsageStats.class)))
    public Response usageStats() {
        Principal principal = securityContextHolder.requirePrincipal();
        authorizationEngine.require(principal, ResourceRef.user(principal.userId()), Capability.READ);
        return Response.ok(apiKeyService.usageStats(principal.userId())).build();
    }

    @GET
    @Path("/{id}")
    @Operation(summary = "Get an API key")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "API key",
            content = @Content(schema = @Schema(implementation = ApiKeyDto.class))),
        @APIResponse(responseCode = "403", description = "Access denied"),
        @APIResponse(responseCode = "404", description = "API key not found")
    })
    public Response getKey(@PathParam("id") String id) {
        Principal principal = securityContextHolder.requirePrincipal();
        authorizationEngine.require(principal, ResourceRef.apiKey(id), Capability.READ);

        return apiKeyService.findById(id)
            .map(key -> Response.ok(ApiKeyDto.from(key)).build())
            .orElseGet(() -> notFound(id));
    }

    @PATCH
    @Path("/{id}")
    @Operation(summary = "Rename, describe, activate or deactivate an API key")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "API key updated"),
        @APIResponse(responseCode = "400", description = "Invalid name"),
        @APIResponse(responseCode = "403", description = "Access denied"),
        @APIResponse(responseCode = "404", description = "API key not found")
    })
    public Response updateKey(@PathParam("id") String id, @Valid UpdateApiKeyRequest request) {
        Principal principal = securityContextHolder.requirePrincipal();
        authorizationEngine.require(principal, ResourceRef.apiKey(id), Capability.WRITE);

        Result<ApiKey> result = apiKeyService.update(id, request.name(), request.description(), request.active());
        if (result instanceof Result.Failure<ApiKey> f) {
            return ApiResponses.toResponse(f.error());
        }
        return Response.ok(ApiKeyDto.from(((Result.Success<ApiKey>) result).value())).build();
    }

    @DELETE
    @Path("/{id}")
    @Operation(summary = "Delete an API key")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "API key deleted"),
        @APIResponse(responseCode = "403", description = "Access denied"),
        @APIResponse(responseCode = "404", description = "API key not found")
    })
    public Response deleteKey(@PathParam("id") String id) {
        Principal principal = securityContextHolder.requirePrincipal();
        authorizationEngine.require(principal, ResourceRef.apiKey(id), Capability.DELETE);

        Result<String> result = apiKeyService.delete(id);
        if (result instanceof Result.Failure<String> f) {
            return ApiResponses.toResponse(f.error());
        }
        LOG.infof("API key %s deleted by %s", id, principal.userId());
        return Response.ok(new DeleteResponse(id, "api key")).build();
    }

    private static Response notFound(String id) {
        return ApiResponses.toResponse(new UseCaseError.NotFoundError("API_KEY_NOT_FOUND", "API key not found",
            Map.of("keyId", id)));
    }

    // ==================== DTOs ====================

    public record ApiKeyDto(
        String id,
        String name,
        String description,
        @Schema(description = "First characters of the key, for recognition", example = "sk_a1B2c")
        String keyPrefix,
        List<String> scopes,
        boolean active,
        Instant expiresAt,
        Instant createdAt,
        Instant lastUsedAt,
        long usageCount
    ) {
        static ApiKeyDto from(ApiKey key) {
            return new ApiKeyDto(key.id, key.name, key.description, key.keyPrefix, List.copyOf(key.scopes),
                key.active, key.expiresAt, key.createdAt, key.lastUsedAt, key.usageCount);
        }
    }

    public record ApiKeyListResponse(
        List<ApiKeyDto> apiKeys,
        int total
    ) {}

    public record CreateApiKeyRequest(
        @NotBlank(message = "Name is required")
        @Size(max = 100, message = "Name must be at most 100 characters")
        String name,

        @Size(max = 500, message = "Description must be at most 500 characters")
        String description,

        @NotEmpty(message = "At least one scope is required")
        List<String> scopes,

        Integer expiresInDays
    ) {}

    public record UpdateApiKeyRequest(
        @Size(max = 100, message = "Name must be at most 100 characters")
        String name,

        @Size(max = 500, message = "Description must be at most 500 characters")
        String description,

        Boolean active
    ) {}

    public record CreatedApiKeyResponse(
        ApiKeyDto apiKey,
        @Schema(description = "The full secret. Shown only once.")
        String key
    ) {
        @Override
        public String toString() {
            return "CreatedApiKeyResponse[id=" + apiKey.id() + "]";
        }
    }
}
