package uk.gegc.quizforge.shared.exception;

/**
 * Exception thrown when no configured provider can serve a request
 */
public class NoProviderConfiguredException extends RuntimeException {

    public NoProviderConfiguredException(String message) {
        super(message);
    }
}
