package tech.simplekanban.platform.common.errors;

import java.util.Map;

/**
 * Sealed error hierarchy for management operation failures.
 *
 * Errors are categorized by type to enable consistent HTTP status mapping.
 */
public sealed interface UseCaseError {

    String code();
    String message();
    Map<String, Object> details();

    /**
     * Input validation failed. Maps to HTTP 400 Bad Request.
     */
    record ValidationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {
        public ValidationError(String code, String message) {
            this(code, message, Map.of());
        }
    }

    /**
     * Business rule violation (duplicate membership, last owner, ...).
     * Maps to HTTP 409 Conflict.
     */
    record BusinessRuleViolation(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {
        public BusinessRuleViolation(String code, String message) {
            this(code, message, Map.of());
        }
    }

    /**
     * Entity not found. Maps to HTTP 404 Not Found.
     */
    record NotFoundError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {
        public NotFoundError(String code, String message) {
            this(code, message, Map.of());
        }
    }

    /**
     * Principal not allowed to perform this action. Maps to HTTP 403 Forbidden.
     */
    record AuthorizationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {
        public AuthorizationError(String code, String message) {
            this(code, message, Map.of());
        }
    }
}
