package uk.gegc.quizforge.features.cache.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Removes expired cache entries so that stale rows do not wait for a lookup to be dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CachePurgeScheduler {

    private final QuestionCacheService cacheService;

    @Scheduled(
            fixedDelayString = "${quizforge.cache.purge-fixed-delay-minutes:60}",
            initialDelayString = "${quizforge.cache.purge-fixed-delay-minutes:60}",
            timeUnit = java.util.concurrent.TimeUnit.MINUTES
    )
    public void purgeExpiredEntries() {
        try {
            int removed = cacheService.purgeExpired();
            log.debug("Cache purge finished, removed {}", removed);
        } catch (Exception e) {
            log.error("Error during cache purge", e);
        }
    }
}
