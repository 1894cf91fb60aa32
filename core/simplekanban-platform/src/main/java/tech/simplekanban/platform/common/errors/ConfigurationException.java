package tech.simplekanban.platform.common.errors;

/**
 * Fatal configuration problem detected at startup (missing or weak secret, ...).
 *
 * <p>Thrown from startup beans and never caught, so the application refuses to start.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
