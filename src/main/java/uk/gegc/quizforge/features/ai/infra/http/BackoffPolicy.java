package uk.gegc.quizforge.features.ai.infra.http;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.quizforge.shared.config.ProviderRetryConfig;
import uk.gegc.quizforge.shared.exception.ProviderException;

/**
 * Exponential back-off between provider attempts.
 */
@Component
@RequiredArgsConstructor
public class BackoffPolicy {

    private final ProviderRetryConfig retryConfig;

    /**
     * Delay before the retry that follows the given (1-based) failed attempt:
     * {@code baseDelay * 2^(attempt-1)}, with optional jitter, capped at the max delay.
     */
    public long delayFor(int attempt) {
        long exponentialDelay = retryConfig.getBaseDelayMs() * (1L << Math.min(Math.max(attempt - 1, 0), 30));

        double jitterRange = retryConfig.getJitterFactor();
        if (jitterRange > 0) {
            double jitter = (1.0 - jitterRange) + (Math.random() * 2 * jitterRange);
            exponentialDelay = (long) (exponentialDelay * jitter);
        }
        return Math.min(exponentialDelay, retryConfig.getMaxDelayMs());
    }

    /**
     * Sleep for the specified delay before a retry.
     * This method can be overridden in tests to avoid actual sleeping
     */
    public void sleep(String provider, long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ProviderException(provider, "Interrupted while backing off before retry", ie);
        }
    }
}
