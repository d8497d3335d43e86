package uk.gegc.quizforge.shared.exception;

import lombok.Getter;

/**
 * Exception for rate-limited, overloaded or unreachable providers. Recovered by back-off.
 */
@Getter
public class TransientProviderException extends RuntimeException {

    private final int statusCode;

    public TransientProviderException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public TransientProviderException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }
}
