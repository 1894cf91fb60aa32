package tech.simplekanban.platform.common;

import tech.simplekanban.platform.common.errors.UseCaseError;

/**
 * Outcome of a user, group or API key operation: either a value or a {@link UseCaseError}.
 *
 * <p>Resources unwrap it with a pattern match:
 * <pre>{@code
 * if (result instanceof Result.Failure<ApiKey> f) {
 *     return ApiResponses.toResponse(f.error());
 * }
 * }</pre>
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    boolean isSuccess();
    boolean isFailure();

    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }
    }

    record Failure<T>(UseCaseError error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(UseCaseError error) {
        return new Failure<>(error);
    }
}
