package uk.gegc.quizforge.shared.exception;

import lombok.Getter;

/**
 * Terminal provider failure after retries and model fallbacks were exhausted.
 */
@Getter
public class ProviderException extends RuntimeException {

    private final String provider;

    public ProviderException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public ProviderException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }
}
