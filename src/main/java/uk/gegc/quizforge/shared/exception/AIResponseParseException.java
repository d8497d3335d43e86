package uk.gegc.quizforge.shared.exception;

import lombok.Getter;

/**
 * Exception thrown when a model response cannot be recovered into JSON.
 * Carries a window of the offending text around the failure position.
 */
@Getter
public class AIResponseParseException extends RuntimeException {

    private final String context;

    public AIResponseParseException(String message) {
        this(message, null, null);
    }

    public AIResponseParseException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public AIResponseParseException(String message, String context, Throwable cause) {
        super(context == null ? message : message + " near: " + context, cause);
        this.context = context;
    }
}
