package uk.gegc.quizforge.shared.exception;

/**
 * Exception thrown when a question or a generation request fails validation
 */
public class QuestionValidationException extends RuntimeException {

    public QuestionValidationException(String message) {
        super(message);
    }

    public QuestionValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
