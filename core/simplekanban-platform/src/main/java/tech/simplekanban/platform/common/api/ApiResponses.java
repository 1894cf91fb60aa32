package tech.simplekanban.platform.common.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import tech.simplekanban.platform.common.errors.UseCaseError;

import java.util.Map;

/**
 * Standard API response DTOs shared by all resources.
 */
public final class ApiResponses {

    private ApiResponses() {} // Prevent instantiation

    // ========================================================================
    // Success Responses
    // ========================================================================

    @Schema(description = "Simple message response")
    public record MessageResponse(
        @Schema(description = "Human-readable message", example = "Logged out")
        String message
    ) {}

    @Schema(description = "Delete operation response")
    public record DeleteResponse(
        @Schema(description = "ID of the deleted resource", example = "key_0ABC123DEF456")
        String id,
        @Schema(description = "Type of resource deleted", example = "api key")
        String resourceType
    ) {}

    // ========================================================================
    // Error Responses
    // ========================================================================

    @Schema(description = "Error response")
    public record ErrorResponse(
        @Schema(description = "Error code for programmatic handling", example = "VALIDATION_ERROR")
        String code,
        @Schema(description = "Human-readable error message", example = "Invalid input provided")
        String message,
        @Schema(description = "Additional error details")
        Map<String, Object> details
    ) {
        public ErrorResponse(String code, String message) {
            this(code, message, Map.of());
        }
    }

    /**
     * Map a management operation failure to its HTTP response.
     */
    public static Response toResponse(UseCaseError error) {
        Response.Status status;
        if (error instanceof UseCaseError.ValidationError) {
            status = Response.Status.BAD_REQUEST;
        } else if (error instanceof UseCaseError.NotFoundError) {
            status = Response.Status.NOT_FOUND;
        } else if (error instanceof UseCaseError.AuthorizationError) {
            status = Response.Status.FORBIDDEN;
        } else {
            status = Response.Status.CONFLICT;
        }
        return Response.status(status)
            .entity(new ErrorResponse(error.code(), error.message(), error.details()))
            .type(MediaType.APPLICATION_JSON)
            .build();
    }
}
