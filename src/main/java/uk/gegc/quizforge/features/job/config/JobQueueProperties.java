package uk.gegc.quizforge.features.job.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the asynchronous generation job queue
 */
@Component
@ConfigurationProperties(prefix = "quizforge.jobs")
@Data
public class JobQueueProperties {

    /**
     * Jobs running at the same time
     */
    private int maxConcurrent = 3;

    /**
     * Finished jobs older than this are removed by the cleanup scheduler
     */
    private int retentionHours = 24;

    private long cleanupFixedDelaySeconds = 3600;
}
