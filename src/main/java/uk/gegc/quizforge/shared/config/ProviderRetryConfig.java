package uk.gegc.quizforge.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for provider retry and back-off behavior
 */
@Component
@ConfigurationProperties(prefix = "quizforge.providers.retry")
@Data
public class ProviderRetryConfig {

    /**
     * Maximum attempts per model for one generation call
     */
    private int maxRetries = 3;

    /**
     * Base delay in milliseconds for exponential backoff
     */
    private long baseDelayMs = 2000;

    /**
     * Maximum delay in milliseconds (cap for exponential backoff)
     */
    private long maxDelayMs = 30000;

    /**
     * Jitter factor for backoff calculation (0.0 = no jitter, 0.5 = ±50% variation)
     */
    private double jitterFactor = 0.0;

    /**
     * Cap on attempts across all models, so that repeated 404 fallbacks cannot loop unbounded
     */
    private int maxTotalAttempts = 10;
}
