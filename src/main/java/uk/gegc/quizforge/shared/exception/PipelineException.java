package uk.gegc.quizforge.shared.exception;

import lombok.Getter;

/**
 * Exception raised by the generation pipeline, tagged with the stage that failed
 */
@Getter
public class PipelineException extends RuntimeException {

    private final String stage;

    public PipelineException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    public PipelineException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }
}
