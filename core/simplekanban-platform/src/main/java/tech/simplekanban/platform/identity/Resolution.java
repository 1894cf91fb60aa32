package tech.simplekanban.platform.identity;

/**
 * Outcome of resolving a raw credential: a principal or a typed failure.
 */
public sealed interface Resolution permits Resolution.Resolved, Resolution.Failed {

    record Resolved(Principal principal) implements Resolution {}

    record Failed(AuthFailure failure) implements Resolution {}

    static Resolution resolved(Principal principal) {
        return new Resolved(principal);
    }

    static Resolution failed(AuthFailure failure) {
        return new Failed(failure);
    }
}
