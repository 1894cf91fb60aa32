package tech.simplekanban.platform.identity;

/**
 * Raised by credential validation with the typed reason. Carries no stack trace since
 * garbage credentials are an expected, high-volume input.
 */
public class CredentialRejectedException extends RuntimeException {

    private final AuthFailure failure;

    public CredentialRejectedException(AuthFailure failure) {
        super(failure.name(), null, false, false);
        this.failure = failure;
    }

    public AuthFailure failure() {
        return failure;
    }
}
