package uk.gegc.quizforge.features.cache.application;

import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;

import java.util.Optional;

/**
 * Persistent cache of generated question sets keyed by the fingerprint of (text, options, provider).
 * Cache failures are logged and never surface to callers.
 */
public interface QuestionCacheService {

    /**
     * Cached set marked with {@code cached}, {@code cacheAgeMinutes} and {@code accessCount}, if fresh
     */
    Optional<QuestionSet> get(String text, GenerationOptions options, String provider);

    void put(String text, GenerationOptions options, String provider, QuestionSet questionSet);

    /**
     * Writes in the background; the caller never waits and never sees a failure
     */
    void putAsync(String text, GenerationOptions options, String provider, QuestionSet questionSet);

    /**
     * @return number of entries removed
     */
    int clear();

    int purgeExpired();

    CacheStats stats();

    boolean isEnabled();
}
