package uk.gegc.quizforge.features.cache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the persistent question cache
 */
@Component
@ConfigurationProperties(prefix = "quizforge.cache")
@Data
public class CacheProperties {

    private boolean enabled = true;

    /**
     * Entries older than this are treated as misses and purged
     */
    private int ttlDays = 30;

    /**
     * Least recently accessed entries beyond this count are evicted on write
     */
    private int maxEntries = 1000;

    private long purgeFixedDelayMinutes = 60;
}
