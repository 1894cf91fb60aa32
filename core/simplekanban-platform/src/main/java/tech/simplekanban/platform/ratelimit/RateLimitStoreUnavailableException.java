package tech.simplekanban.platform.ratelimit;

/**
 * The shared rate-limit store could not answer in time.
 */
public class RateLimitStoreUnavailableException extends RuntimeException {

    public RateLimitStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
