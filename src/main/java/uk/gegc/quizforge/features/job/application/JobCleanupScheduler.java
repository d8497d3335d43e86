package uk.gegc.quizforge.features.job.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.quizforge.features.job.config.JobQueueProperties;

import java.time.Duration;

/**
 * Removes completed, failed and cancelled jobs once they are older than the retention window.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobCleanupScheduler {

    private final GenerationJobStore jobStore;
    private final JobQueueProperties properties;

    @Scheduled(fixedDelayString = "${quizforge.jobs.cleanup-fixed-delay-seconds:3600}000")
    public void removeFinishedJobs() {
        log.debug("Running scheduled cleanup of finished generation jobs");
        try {
            jobStore.clearFinished(Duration.ofHours(properties.getRetentionHours()));
        } catch (Exception e) {
            log.error("Error during scheduled cleanup of finished generation jobs", e);
        }
    }
}
