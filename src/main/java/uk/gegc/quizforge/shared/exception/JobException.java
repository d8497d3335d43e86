package uk.gegc.quizforge.shared.exception;

/**
 * Exception thrown when a generation job operation is not allowed in its current state
 */
public class JobException extends RuntimeException {

    public JobException(String message) {
        super(message);
    }

    public JobException(String message, Throwable cause) {
        super(message, cause);
    }
}
