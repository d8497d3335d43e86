package uk.gegc.quizforge.shared.exception;

import lombok.Getter;

/**
 * Exception thrown when the vendor reports the requested model as unknown (404).
 * Recovered by moving to the next model of the provider.
 */
@Getter
public class ModelUnavailableException extends RuntimeException {

    private final String model;

    public ModelUnavailableException(String model, String message) {
        super(message);
        this.model = model;
    }

    public ModelUnavailableException(String model, String message, Throwable cause) {
        super(message, cause);
        this.model = model;
    }
}
