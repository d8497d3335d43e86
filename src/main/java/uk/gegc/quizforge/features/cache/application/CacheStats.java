package uk.gegc.quizforge.features.cache.application;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CacheStats(
        long totalEntries,
        long totalAccesses,
        double avgAccesses,
        Instant lastAccess,
        Instant oldestEntry,
        int maxEntries,
        int ttlDays,
        boolean enabled,
        long hits,
        long misses
) {
}
