package uk.gegc.quizforge.shared.exception;

/**
 * Exception thrown when a provider cannot be used because of its configuration:
 * missing credentials, an exhausted model list or an unreachable local endpoint.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
